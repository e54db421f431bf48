package filament.model.component;

import filament.model.ast.FilPort;
import filament.model.expr.Expression;
import filament.model.expr.Interval;

/**
 * A port of a component signature, with its interval relative to the component's event.
 */
public final class Port {
	public enum Direction {
		INPUT,
		OUTPUT,
	}

	private final String name;
	private final Direction direction;
	private final boolean isInterface;
	private final Interval interval;
	private final Expression width;
	private final FilPort node;

	public Port(String name, Direction direction, boolean isInterface, Interval interval, Expression width,
	            FilPort node) {
		this.name = name;
		this.direction = direction;
		this.isInterface = isInterface;
		this.interval = interval;
		this.width = width;
		this.node = node;
	}

	public String getName() {
		return name;
	}

	public Direction getDirection() {
		return direction;
	}

	public boolean isInterface() {
		return isInterface;
	}

	public Interval getInterval() {
		return interval;
	}

	public Expression getWidth() {
		return width;
	}

	public FilPort getNode() {
		return node;
	}
}
