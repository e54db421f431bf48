package filament.model.expr;

/**
 * Thrown when an interval is built whose length is a literal that is not positive.
 */
public class MalformedIntervalException extends RuntimeException {
	private final TimeExpression start;
	private final TimeExpression end;

	public MalformedIntervalException(TimeExpression start, TimeExpression end) {
		super("interval [" + start.render() + ", " + end.render() + "] does not end after it starts");
		this.start = start;
		this.end = end;
	}

	public TimeExpression getStart() {
		return start;
	}

	public TimeExpression getEnd() {
		return end;
	}
}
