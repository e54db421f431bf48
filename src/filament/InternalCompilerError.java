package filament;

/**
 * Thrown when an invariant established by an earlier pass does not hold. Never caused by user input.
 */
public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError(String reason) {
		super("internal compiler error: " + reason);
	}

	public InternalCompilerError(String reason, Throwable cause) {
		super("internal compiler error: " + reason, cause);
	}
}
