package filament.trans;

import filament.FilamentException;

/**
 * Raised when a compilation stage finishes with errors. The message is the formatted issue report.
 */
public class FilamentTransException extends FilamentException {

	private static final long serialVersionUID = 4183330512620985107L;
	private static final String prefix = "Compilation Error";

	public FilamentTransException(String msg) {
		super(prefix, msg);
	}

}
