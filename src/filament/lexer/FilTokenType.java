package filament.lexer;

public enum FilTokenType {
	IDENT,
	NUMBER,
	STRING,
	KEYWORD,
	SYMBOL,
	EOF,
}
