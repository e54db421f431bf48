package filament.model.ast;

import filament.util.SourceLocation;

import java.util.List;

/**
 * AST node:
 *
 * name := new Component[args];
 */
public class FilInstance extends FilCommand {
	private final FilName name;
	private final FilName component;
	private final List<FilExpression> args;

	public FilInstance(SourceLocation location, FilName name, FilName component, List<FilExpression> args) {
		super(location);
		this.name = name;
		this.component = component;
		this.args = args;
	}

	public FilName getName() {
		return name;
	}

	public FilName getComponent() {
		return component;
	}

	public List<FilExpression> getArgs() {
		return args;
	}

	@Override
	public <T, E extends Throwable> T accept(FilCommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
