package filament.model.ast;

import filament.util.SourceLocation;

public abstract class FilPortRef extends FilNode {

	public FilPortRef(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(FilPortRefVisitor<T, E> v) throws E;
}
