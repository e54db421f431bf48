package filament.trans.passes.mono;

import filament.model.component.Port;

/**
 * A port of a specialized component. The interval is relative to the component's event at cycle 0.
 */
public final class MonoPort {
	private final String name;
	private final Port.Direction direction;
	private final boolean isInterface;
	private final long start;
	private final long end;
	private final long width;

	public MonoPort(String name, Port.Direction direction, boolean isInterface, long start, long end, long width) {
		this.name = name;
		this.direction = direction;
		this.isInterface = isInterface;
		this.start = start;
		this.end = end;
		this.width = width;
	}

	public String getName() {
		return name;
	}

	public Port.Direction getDirection() {
		return direction;
	}

	public boolean isInterface() {
		return isInterface;
	}

	public long getStart() {
		return start;
	}

	public long getEnd() {
		return end;
	}

	public long getWidth() {
		return width;
	}
}
