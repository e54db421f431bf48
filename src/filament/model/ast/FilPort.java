package filament.model.ast;

import filament.util.SourceLocation;

/**
 * AST node, one of:
 *
 * name: interface[time]
 * name: [start, end] width
 */
public class FilPort extends FilNode {
	private final FilName name;
	private final boolean isInterface;
	private final FilExpression start;
	private final FilExpression end;
	private final FilExpression width;

	private FilPort(SourceLocation location, FilName name, boolean isInterface, FilExpression start,
	                FilExpression end, FilExpression width) {
		super(location);
		this.name = name;
		this.isInterface = isInterface;
		this.start = start;
		this.end = end;
		this.width = width;
	}

	public static FilPort interfacePort(SourceLocation location, FilName name, FilExpression time) {
		return new FilPort(location, name, true, time, null, null);
	}

	public static FilPort dataPort(SourceLocation location, FilName name, FilExpression start, FilExpression end,
	                               FilExpression width) {
		return new FilPort(location, name, false, start, end, width);
	}

	public FilName getName() {
		return name;
	}

	public boolean isInterface() {
		return isInterface;
	}

	/**
	 * @return the interval start, or the triggering time of an interface port
	 */
	public FilExpression getStart() {
		return start;
	}

	/**
	 * @return the interval end; null for interface ports
	 */
	public FilExpression getEnd() {
		return end;
	}

	/**
	 * @return the bit-width; null for interface ports, which are one bit wide
	 */
	public FilExpression getWidth() {
		return width;
	}
}
