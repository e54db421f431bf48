package filament.model.ast;

import filament.util.SourceLocation;

/**
 * A literal argument. Constants are available at every time step.
 */
public class FilConstantPortRef extends FilPortRef {
	private final long value;

	public FilConstantPortRef(SourceLocation location, long value) {
		super(location);
		this.value = value;
	}

	public long getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(FilPortRefVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
