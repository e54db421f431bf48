package filament.model.ast;

import filament.util.SourceLocation;

/**
 * AST node, inside a component body:
 *
 * exists L = value;
 */
public class FilExistentialDefinition extends FilCommand {
	private final FilName name;
	private final FilExpression value;

	public FilExistentialDefinition(SourceLocation location, FilName name, FilExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public FilName getName() {
		return name;
	}

	public FilExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(FilCommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
