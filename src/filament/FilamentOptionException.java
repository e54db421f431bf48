package filament;

public class FilamentOptionException extends FilamentException {
	private static final String prefix = "Option Error";

	public FilamentOptionException(String msg) {
		super(prefix, msg);
	}
}
