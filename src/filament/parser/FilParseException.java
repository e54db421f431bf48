package filament.parser;

import filament.util.SourceLocation;

@SuppressWarnings("serial")
public class FilParseException extends Exception {
	private final SourceLocation location;

	public FilParseException(SourceLocation location, String message) {
		super(message);
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}
}
