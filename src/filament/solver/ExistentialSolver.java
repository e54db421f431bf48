package filament.solver;

import filament.errors.IssueContext;
import filament.model.expr.Atom;
import filament.model.expr.Constraint;
import filament.model.expr.Expression;
import filament.trans.passes.check.UnderconstrainedExistentialIssue;
import filament.util.SourceLocatable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixes the values of a component's free existentials once every value parameter is a literal. The remaining
 * constraints must have exactly one solution; several solutions are reported rather than picking one.
 */
public final class ExistentialSolver {
	private ExistentialSolver() {}

	/**
	 * @param subject names the specialization in diagnostics, e.g. "main[]"
	 * @param free the existentials to solve for; every other atom must already be substituted away
	 * @return the unique value of every free existential, or empty if an issue was reported
	 */
	public static Optional<Map<Atom, Long>> perform(IssueContext ctx, SolverFactory factory, String subject,
	                                                SourceLocatable where, Collection<Atom> free,
	                                                List<Constraint> constraints) {
		if (free.isEmpty()) {
			List<Constraint> violated = new ArrayList<>();
			for (Constraint c : constraints) {
				if (!c.evaluate(Collections.emptyMap())) {
					violated.add(c);
				}
			}
			if (!violated.isEmpty()) {
				ctx.error(new UnsatisfiableConstraintsIssue(subject, violated, null));
				return Optional.empty();
			}
			return Optional.of(Collections.emptyMap());
		}

		try (SolverSession session = factory.open()) {
			for (Atom atom : free) {
				session.declare(atom);
			}
			session.push();
			for (Constraint c : constraints) {
				session.assume(c);
			}
			SatResult result = DischargePass.timedCheck(session, "existentials of " + subject);
			if (result == SatResult.UNSAT) {
				session.pop();
				ctx.error(new UnsatisfiableConstraintsIssue(subject, minimalCore(session, constraints), null));
				return Optional.empty();
			}
			if (result == SatResult.UNKNOWN) {
				ctx.error(new SolverFailureIssue("could not decide the existentials of " + subject, null));
				return Optional.empty();
			}

			Map<Atom, Long> model = new LinkedHashMap<>(session.model(free));
			boolean unique = true;
			for (Atom atom : free) {
				Expression variable = Expression.of(atom);
				Expression value = Expression.constant(model.get(atom));
				boolean determined = true;
				for (Constraint alternative : Arrays.asList(
						Constraint.gt(value, variable, Constraint.Reason.EXISTENTIAL_DEFINITION, where),
						Constraint.gt(variable, value, Constraint.Reason.EXISTENTIAL_DEFINITION, where))) {
					session.push();
					session.assume(alternative);
					SatResult other = DischargePass.timedCheck(session, "uniqueness of " + atom.render());
					if (other == SatResult.SAT) {
						long otherValue = session.model(Collections.singletonList(atom)).get(atom);
						ctx.error(new UnderconstrainedExistentialIssue(where, atom.render(),
								"in " + subject + " it may be " + model.get(atom) + " or " + otherValue));
						determined = false;
					} else if (other == SatResult.UNKNOWN) {
						ctx.error(new SolverFailureIssue("could not decide whether " + atom.render() + " of " +
								subject + " is unique", null));
						determined = false;
					}
					session.pop();
					if (!determined) {
						break;
					}
				}
				unique &= determined;
			}
			session.pop();
			return unique ? Optional.of(model) : Optional.empty();
		} catch (SolverException e) {
			ctx.error(new SolverFailureIssue(e.getMessage(), e));
			return Optional.empty();
		}
	}

	// deletion-based: drop each clause whose removal keeps the rest unsatisfiable
	private static List<Constraint> minimalCore(SolverSession session, List<Constraint> constraints) {
		List<Constraint> core = new ArrayList<>(constraints);
		for (Constraint candidate : constraints) {
			List<Constraint> without = new ArrayList<>(core);
			without.remove(candidate);
			session.push();
			for (Constraint c : without) {
				session.assume(c);
			}
			SatResult result = session.check();
			session.pop();
			if (result == SatResult.UNSAT) {
				core = without;
			}
		}
		return core;
	}
}
