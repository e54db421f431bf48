package filament.model.expr;

import java.util.Map;
import java.util.Objects;

/**
 * The half-open availability window [start, end) of a signal.
 */
public final class Interval {
	private final TimeExpression start;
	private final TimeExpression end;

	private Interval(TimeExpression start, TimeExpression end) {
		this.start = start;
		this.end = end;
	}

	/**
	 * @throws MalformedIntervalException if end - start is a literal that is not positive
	 */
	public static Interval of(TimeExpression start, TimeExpression end) {
		Expression length = end.minus(start);
		if (length.isConstant() && length.getConstant() <= 0) {
			throw new MalformedIntervalException(start, end);
		}
		return new Interval(start, end);
	}

	/**
	 * The single cycle [time, time+1].
	 */
	public static Interval cycle(TimeExpression time) {
		return new Interval(time, time.shift(1));
	}

	public TimeExpression getStart() {
		return start;
	}

	public TimeExpression getEnd() {
		return end;
	}

	public Expression length() {
		return end.minus(start);
	}

	public Interval substitute(Map<Atom, Expression> substitution) {
		return of(start.substitute(substitution), end.substitute(substitution));
	}

	public Interval substituteEvent(TimeExpression time) {
		return new Interval(start.substituteEvent(time), end.substituteEvent(time));
	}

	public String render() {
		return "[" + start.render() + ", " + end.render() + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Interval interval = (Interval) o;
		return start.equals(interval.start) && end.equals(interval.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return render();
	}
}
