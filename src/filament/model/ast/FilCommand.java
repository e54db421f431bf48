package filament.model.ast;

import filament.util.SourceLocation;

public abstract class FilCommand extends FilNode {

	public FilCommand(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(FilCommandVisitor<T, E> v) throws E;
}
