package filament.model.ast;

import filament.util.SourceLocation;

public abstract class FilExpression extends FilNode {

	public FilExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(FilExpressionVisitor<T, E> v) throws E;
}
