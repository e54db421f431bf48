package filament.model.ast;

import filament.util.SourceLocation;

public class FilNumber extends FilExpression {
	private final long value;

	public FilNumber(SourceLocation location, long value) {
		super(location);
		this.value = value;
	}

	public long getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(FilExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
