package filament.trans.passes.check;

import filament.InternalCompilerError;
import filament.errors.IssueContext;
import filament.model.ast.FilBinOp;
import filament.model.ast.FilExpression;
import filament.model.ast.FilExpressionVisitor;
import filament.model.ast.FilFieldAccess;
import filament.model.ast.FilGuard;
import filament.model.ast.FilNumber;
import filament.model.ast.FilVariable;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.model.expr.TimeExpression;

import java.util.Map;
import java.util.Optional;

/**
 * Translates expressions of one component's source into canonical form. Names must already be resolved.
 */
public class ExpressionBuilder extends FilExpressionVisitor<Expression, RuntimeException> {
	private final Map<String, Atom> names;
	private final Atom event;

	/**
	 * @param names the atom each plain name stands for, including the event
	 */
	public ExpressionBuilder(Map<String, Atom> names, String event) {
		this.names = names;
		this.event = Atom.event(event);
	}

	public Expression build(FilExpression expression) {
		return expression.accept(this);
	}

	/**
	 * Reads expression as the event plus an offset.
	 *
	 * @return empty after reporting an issue if the event does not occur exactly once as a plain summand
	 */
	public Optional<TimeExpression> buildTime(IssueContext ctx, FilExpression expression, String what) {
		Expression value = build(expression);
		Optional<Expression> coefficient = value.linearCoefficient(event);
		if (!coefficient.isPresent() || !coefficient.get().equals(Expression.ONE)) {
			ctx.error(new MalformedIntervalIssue(expression,
					what + " must be " + event.getName() + " plus an offset, found " + value.render(), null));
			return Optional.empty();
		}
		return Optional.of(new TimeExpression(event.getName(), value.withoutAtom(event)));
	}

	public Constraint buildGuard(FilGuard guard, Constraint.Reason reason) {
		Expression lhs = build(guard.getLhs());
		Expression rhs = build(guard.getRhs());
		switch (guard.getOperator()) {
			case GT:
				return Constraint.gt(lhs, rhs, reason, guard);
			case GE:
				return Constraint.ge(lhs, rhs, reason, guard);
			case LT:
				return Constraint.gt(rhs, lhs, reason, guard);
			case LE:
				return Constraint.ge(rhs, lhs, reason, guard);
			case EQ:
				return Constraint.eq(lhs, rhs, reason, guard);
			default:
				throw new InternalCompilerError("unknown guard operator " + guard.getOperator());
		}
	}

	@Override
	public Expression visit(FilNumber number) {
		return Expression.constant(number.getValue());
	}

	@Override
	public Expression visit(FilVariable variable) {
		Atom atom = names.get(variable.getName());
		if (atom == null) {
			throw new InternalCompilerError("unresolved name " + variable.getName() + " survived scoping");
		}
		return Expression.of(atom);
	}

	@Override
	public Expression visit(FilFieldAccess fieldAccess) {
		return Expression.of(Atom.instanceExistential(
				fieldAccess.getInstance().getId(), fieldAccess.getField().getId()));
	}

	@Override
	public Expression visit(FilBinOp binOp) {
		Expression lhs = binOp.getLhs().accept(this);
		Expression rhs = binOp.getRhs().accept(this);
		switch (binOp.getOperator()) {
			case PLUS:
				return lhs.plus(rhs);
			case MINUS:
				return lhs.minus(rhs);
			case TIMES:
				return lhs.times(rhs);
			default:
				throw new InternalCompilerError("unknown operator " + binOp.getOperator());
		}
	}
}
