package filament.model.ast;

import filament.util.SourceLocation;

public class FilImport extends FilNode {
	private final String path;

	public FilImport(SourceLocation location, String path) {
		super(location);
		this.path = path;
	}

	public String getPath() {
		return path;
	}
}
