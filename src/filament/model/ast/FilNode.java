package filament.model.ast;

import filament.util.SourceLocatable;
import filament.util.SourceLocation;

public abstract class FilNode extends SourceLocatable {
	private final SourceLocation location;

	public FilNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}
}
