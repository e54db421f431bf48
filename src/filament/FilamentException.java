package filament;

/**
 * Base of the exceptions that abort a compilation. The full message is "prefix: msg"; {@link #getMsg()} returns the
 * part after the prefix, which is what gets shown to the user.
 */
public abstract class FilamentException extends RuntimeException {

	private static final long serialVersionUID = 7310957416603310283L;

	private final String msg;

	protected FilamentException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}
}
