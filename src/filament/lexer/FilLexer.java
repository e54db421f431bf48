package filament.lexer;

import filament.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A regex-driven lexer for Filament source. Comments and whitespace are dropped; the token list always ends with
 * a single EOF token.
 */
public class FilLexer {

	static final Pattern WHITESPACE = Pattern.compile("\\s+");
	static final Pattern LINE_COMMENT = Pattern.compile("//[^\n]*");
	static final Pattern BLOCK_COMMENT_START = Pattern.compile("/\\*");
	static final Pattern BLOCK_COMMENT_END = Pattern.compile("\\*/");
	static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	static final Pattern NUMBER = Pattern.compile("[0-9]+");
	static final Pattern STRING = Pattern.compile("\"([^\"\\\\\n]*)\"");

	static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
			"import", "extern", "comp", "with", "where", "exists", "new", "interface"));

	// longest symbols first so that ":=" wins over ":"
	static final String[] SYMBOLS = {
			":=", "->", ">=", "<=", "==",
			"(", ")", "[", "]", "{", "}", "<", ">", "=", ",", ";", ":", ".", "+", "-", "*",
	};

	private final Path file;
	private final CharSequence contents;

	private int offset = 0;
	private int line = 0;
	private int column = 0;

	public FilLexer(Path file, CharSequence contents) {
		this.file = file;
		this.contents = contents;
	}

	private SourceLocation locationOf(int startOffset, int startLine, int startColumn) {
		return new SourceLocation(file, startOffset, offset, startLine, line, startColumn, column);
	}

	private void advanceTo(int end) {
		while (offset < end) {
			if (contents.charAt(offset) == '\n') {
				line++;
				column = 0;
			} else {
				column++;
			}
			offset++;
		}
	}

	private boolean lookingAt(Matcher m) {
		m.region(offset, contents.length());
		return m.lookingAt();
	}

	/**
	 * @return the tokens of the whole input, terminated by an EOF token
	 * @throws FilLexerException on an unterminated comment or a character that starts no token
	 */
	public List<FilToken> readTokens() throws FilLexerException {
		List<FilToken> tokens = new ArrayList<>();
		Matcher whitespace = WHITESPACE.matcher(contents);
		Matcher lineComment = LINE_COMMENT.matcher(contents);
		Matcher blockStart = BLOCK_COMMENT_START.matcher(contents);
		Matcher blockEnd = BLOCK_COMMENT_END.matcher(contents);
		Matcher ident = IDENT.matcher(contents);
		Matcher number = NUMBER.matcher(contents);
		Matcher string = STRING.matcher(contents);

		while (offset < contents.length()) {
			int startOffset = offset;
			int startLine = line;
			int startColumn = column;

			if (lookingAt(whitespace)) {
				advanceTo(whitespace.end());
			} else if (lookingAt(lineComment)) {
				advanceTo(lineComment.end());
			} else if (lookingAt(blockStart)) {
				blockEnd.region(blockStart.end(), contents.length());
				if (!blockEnd.find()) {
					advanceTo(blockStart.end());
					throw new FilLexerException(locationOf(startOffset, startLine, startColumn), "unterminated comment");
				}
				advanceTo(blockEnd.end());
			} else if (lookingAt(ident)) {
				advanceTo(ident.end());
				String value = ident.group();
				FilTokenType type = KEYWORDS.contains(value) ? FilTokenType.KEYWORD : FilTokenType.IDENT;
				tokens.add(new FilToken(value, type, locationOf(startOffset, startLine, startColumn)));
			} else if (lookingAt(number)) {
				advanceTo(number.end());
				tokens.add(new FilToken(number.group(), FilTokenType.NUMBER,
						locationOf(startOffset, startLine, startColumn)));
			} else if (lookingAt(string)) {
				advanceTo(string.end());
				tokens.add(new FilToken(string.group(1), FilTokenType.STRING,
						locationOf(startOffset, startLine, startColumn)));
			} else {
				String symbol = matchSymbol();
				if (symbol == null) {
					advanceTo(offset + 1);
					throw new FilLexerException(locationOf(startOffset, startLine, startColumn),
							"unexpected character '" + contents.charAt(startOffset) + "'");
				}
				advanceTo(offset + symbol.length());
				tokens.add(new FilToken(symbol, FilTokenType.SYMBOL, locationOf(startOffset, startLine, startColumn)));
			}
		}
		tokens.add(new FilToken("", FilTokenType.EOF, locationOf(offset, line, column)));
		return tokens;
	}

	private String matchSymbol() {
		for (String symbol : SYMBOLS) {
			if (offset + symbol.length() <= contents.length() &&
					contents.subSequence(offset, offset + symbol.length()).toString().equals(symbol)) {
				return symbol;
			}
		}
		return null;
	}
}
