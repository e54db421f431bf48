package filament.solver;

/**
 * Raised by a {@link SolverSession} when the decision procedure itself fails, e.g. a solver process dies or
 * answers something outside the protocol.
 */
public class SolverException extends RuntimeException {
	public SolverException(String message) {
		super(message);
	}

	public SolverException(String message, Throwable cause) {
		super(message, cause);
	}
}
