package filament.model.ast;

import filament.util.SourceLocation;

/**
 * A bare identifier inside an expression: a value parameter, the event, or an existential.
 */
public class FilVariable extends FilExpression {
	private final String name;

	public FilVariable(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(FilExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
