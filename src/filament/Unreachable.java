package filament;

/**
 * Wraps a checked exception that is declared but cannot occur, such as an {@link java.io.IOException} raised while
 * writing into a {@link java.io.StringWriter}.
 */
public class Unreachable extends RuntimeException {

	private static final long serialVersionUID = -2207153869264733790L;

	public Unreachable(Throwable cause) {
		super("impossible " + cause.getClass().getSimpleName() + " in an in-memory operation", cause);
	}
}
