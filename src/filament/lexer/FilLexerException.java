package filament.lexer;

import filament.parser.FilParseException;
import filament.util.SourceLocation;

@SuppressWarnings("serial")
public class FilLexerException extends FilParseException {

	public FilLexerException(SourceLocation location, String message) {
		super(location, message);
	}

}
