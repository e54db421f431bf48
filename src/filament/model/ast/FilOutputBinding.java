package filament.model.ast;

import filament.util.SourceLocation;

/**
 * AST node:
 *
 * out = source;
 */
public class FilOutputBinding extends FilCommand {
	private final FilName port;
	private final FilPortRef source;

	public FilOutputBinding(SourceLocation location, FilName port, FilPortRef source) {
		super(location);
		this.port = port;
		this.source = source;
	}

	public FilName getPort() {
		return port;
	}

	public FilPortRef getSource() {
		return source;
	}

	@Override
	public <T, E extends Throwable> T accept(FilCommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
