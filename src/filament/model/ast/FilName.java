package filament.model.ast;

import filament.util.SourceLocation;

/**
 * An identifier at a declaration or reference site.
 */
public class FilName extends FilNode {
	private final String id;

	public FilName(SourceLocation location, String id) {
		super(location);
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public String toString() {
		return id;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return id.equals(((FilName) o).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}
}
