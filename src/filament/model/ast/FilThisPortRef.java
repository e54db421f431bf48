package filament.model.ast;

import filament.util.SourceLocation;

/**
 * A port of the enclosing component, referenced by its bare name.
 */
public class FilThisPortRef extends FilPortRef {
	private final FilName port;

	public FilThisPortRef(SourceLocation location, FilName port) {
		super(location);
		this.port = port;
	}

	public FilName getPort() {
		return port;
	}

	@Override
	public <T, E extends Throwable> T accept(FilPortRefVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
