package filament.model.ast;

import filament.util.SourceLocation;

public class FilGuard extends FilNode {

	public enum Operator {
		GT(">"),
		GE(">="),
		LT("<"),
		LE("<="),
		EQ("==");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final FilExpression lhs;
	private final Operator operator;
	private final FilExpression rhs;

	public FilGuard(SourceLocation location, FilExpression lhs, Operator operator, FilExpression rhs) {
		super(location);
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public FilExpression getLhs() {
		return lhs;
	}

	public Operator getOperator() {
		return operator;
	}

	public FilExpression getRhs() {
		return rhs;
	}
}
