package filament.model.expr;

import filament.InternalCompilerError;

import java.util.Map;
import java.util.Objects;

/**
 * A point in time: an event plus an offset expression that does not mention any event.
 */
public final class TimeExpression {
	private final String event;
	private final Expression offset;

	public TimeExpression(String event, Expression offset) {
		this.event = event;
		this.offset = offset;
	}

	public static TimeExpression of(String event) {
		return new TimeExpression(event, Expression.ZERO);
	}

	public String getEvent() {
		return event;
	}

	public Expression getOffset() {
		return offset;
	}

	public TimeExpression shift(Expression amount) {
		return new TimeExpression(event, offset.plus(amount));
	}

	public TimeExpression shift(long amount) {
		return shift(Expression.constant(amount));
	}

	/**
	 * Composes offsets: replaces this expression's event by time.
	 */
	public TimeExpression substituteEvent(TimeExpression time) {
		return time.shift(offset);
	}

	public TimeExpression substitute(Map<Atom, Expression> substitution) {
		return new TimeExpression(event, offset.substitute(substitution));
	}

	/**
	 * @return this - other, which is only meaningful relative to the same event
	 */
	public Expression minus(TimeExpression other) {
		if (!event.equals(other.event)) {
			throw new InternalCompilerError("cannot compare times over different events " + event + " and " + other.event);
		}
		return offset.minus(other.offset);
	}

	public String render() {
		if (offset.equals(Expression.ZERO)) {
			return event;
		}
		String rendered = offset.render();
		return rendered.startsWith("-") ? event + rendered : event + "+" + rendered;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TimeExpression that = (TimeExpression) o;
		return event.equals(that.event) && offset.equals(that.offset);
	}

	@Override
	public int hashCode() {
		return Objects.hash(event, offset);
	}

	@Override
	public String toString() {
		return render();
	}
}
