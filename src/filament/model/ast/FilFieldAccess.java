package filament.model.ast;

import filament.util.SourceLocation;

/**
 * AST node:
 *
 * instance.L
 *
 * References an existential published by an instance's component.
 */
public class FilFieldAccess extends FilExpression {
	private final FilName instance;
	private final FilName field;

	public FilFieldAccess(SourceLocation location, FilName instance, FilName field) {
		super(location);
		this.instance = instance;
		this.field = field;
	}

	public FilName getInstance() {
		return instance;
	}

	public FilName getField() {
		return field;
	}

	@Override
	public <T, E extends Throwable> T accept(FilExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
