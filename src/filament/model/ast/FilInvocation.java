package filament.model.ast;

import filament.util.SourceLocation;

import java.util.List;

/**
 * AST node:
 *
 * name := instance&lt;time&gt;(args);
 */
public class FilInvocation extends FilCommand {
	private final FilName name;
	private final FilName instance;
	private final FilExpression time;
	private final List<FilPortRef> args;

	public FilInvocation(SourceLocation location, FilName name, FilName instance, FilExpression time,
	                     List<FilPortRef> args) {
		super(location);
		this.name = name;
		this.instance = instance;
		this.time = time;
		this.args = args;
	}

	public FilName getName() {
		return name;
	}

	public FilName getInstance() {
		return instance;
	}

	public FilExpression getTime() {
		return time;
	}

	public List<FilPortRef> getArgs() {
		return args;
	}

	@Override
	public <T, E extends Throwable> T accept(FilCommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
