package filament.model.ast;

import filament.util.SourceLocation;

public class FilBinOp extends FilExpression {

	public enum Operator {
		PLUS("+"),
		MINUS("-"),
		TIMES("*");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Operator operator;
	private final FilExpression lhs;
	private final FilExpression rhs;

	public FilBinOp(SourceLocation location, Operator operator, FilExpression lhs, FilExpression rhs) {
		super(location);
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operator getOperator() {
		return operator;
	}

	public FilExpression getLhs() {
		return lhs;
	}

	public FilExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(FilExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
