package filament.lexer;

import filament.util.SourceLocatable;
import filament.util.SourceLocation;

import java.util.Objects;

public class FilToken extends SourceLocatable {

	private final String value;
	private final FilTokenType type;
	private final SourceLocation location;

	public FilToken(String value, FilTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public FilTokenType getType() {
		return type;
	}

	public boolean is(FilTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	@Override
	public String toString() {
		return "FilToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FilToken other = (FilToken) o;
		return value.equals(other.value) && type == other.type && Objects.equals(location, other.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}
}
