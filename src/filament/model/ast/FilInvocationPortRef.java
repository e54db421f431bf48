package filament.model.ast;

import filament.util.SourceLocation;

/**
 * AST node:
 *
 * invocation.port
 */
public class FilInvocationPortRef extends FilPortRef {
	private final FilName invocation;
	private final FilName port;

	public FilInvocationPortRef(SourceLocation location, FilName invocation, FilName port) {
		super(location);
		this.invocation = invocation;
		this.port = port;
	}

	public FilName getInvocation() {
		return invocation;
	}

	public FilName getPort() {
		return port;
	}

	@Override
	public <T, E extends Throwable> T accept(FilPortRefVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
