package filament.util;

/**
 * A common abstract base for anything that needs to be traced back to the
 * text it was parsed from, typically AST nodes.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
