package filament.parser;

import filament.lexer.FilLexer;
import filament.lexer.FilToken;
import filament.lexer.FilTokenType;
import filament.model.ast.*;
import filament.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A recursive-descent parser over the token list produced by {@link FilLexer}. Stops at the first error.
 */
public final class FilParser {

	private final List<FilToken> tokens;
	private final Path file;
	private int pos = 0;

	private FilParser(Path file, List<FilToken> tokens) {
		this.file = file;
		this.tokens = tokens;
	}

	public static FilUnit readUnit(Path file, CharSequence contents) throws FilParseException {
		FilParser parser = new FilParser(file, new FilLexer(file, contents).readTokens());
		return parser.unit();
	}

	public static FilExpression readExpression(Path file, CharSequence contents) throws FilParseException {
		FilParser parser = new FilParser(file, new FilLexer(file, contents).readTokens());
		FilExpression expression = parser.expression();
		parser.expect(FilTokenType.EOF, "");
		return expression;
	}

	private FilToken peek() {
		return tokens.get(pos);
	}

	private FilToken peek(int ahead) {
		return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
	}

	private FilToken next() {
		FilToken token = tokens.get(pos);
		if (token.getType() != FilTokenType.EOF) {
			pos++;
		}
		return token;
	}

	private SourceLocation previousLocation() {
		return tokens.get(Math.max(0, pos - 1)).getLocation();
	}

	private SourceLocation from(SourceLocation start) {
		return start.combine(previousLocation());
	}

	private boolean atSymbol(String symbol) {
		return peek().is(FilTokenType.SYMBOL, symbol);
	}

	private boolean atKeyword(String keyword) {
		return peek().is(FilTokenType.KEYWORD, keyword);
	}

	private boolean acceptSymbol(String symbol) {
		if (atSymbol(symbol)) {
			next();
			return true;
		}
		return false;
	}

	private boolean acceptKeyword(String keyword) {
		if (atKeyword(keyword)) {
			next();
			return true;
		}
		return false;
	}

	private FilParseException unexpected(String expected) {
		FilToken token = peek();
		String found = token.getType() == FilTokenType.EOF ? "end of file" : "'" + token.getValue() + "'";
		return new FilParseException(token.getLocation(), "expected " + expected + ", found " + found);
	}

	private FilToken expect(FilTokenType type, String value) throws FilParseException {
		if (!peek().is(type, value)) {
			throw unexpected(type == FilTokenType.EOF ? "end of file" : "'" + value + "'");
		}
		return next();
	}

	private FilToken expectSymbol(String symbol) throws FilParseException {
		return expect(FilTokenType.SYMBOL, symbol);
	}

	private FilName name() throws FilParseException {
		if (peek().getType() != FilTokenType.IDENT) {
			throw unexpected("an identifier");
		}
		FilToken token = next();
		return new FilName(token.getLocation(), token.getValue());
	}

	private long number() throws FilParseException {
		if (peek().getType() != FilTokenType.NUMBER) {
			throw unexpected("a number");
		}
		FilToken token = next();
		try {
			return Long.parseLong(token.getValue());
		} catch (NumberFormatException e) {
			throw new FilParseException(token.getLocation(), "number " + token.getValue() + " is too large");
		}
	}

	private FilUnit unit() throws FilParseException {
		SourceLocation start = peek().getLocation();
		List<FilImport> imports = new ArrayList<>();
		List<FilComponent> components = new ArrayList<>();
		while (atKeyword("import")) {
			SourceLocation importStart = next().getLocation();
			if (peek().getType() != FilTokenType.STRING) {
				throw unexpected("a quoted file name");
			}
			String path = next().getValue();
			expectSymbol(";");
			imports.add(new FilImport(from(importStart), path));
		}
		while (peek().getType() != FilTokenType.EOF) {
			components.add(component());
		}
		return new FilUnit(from(start), file, imports, components);
	}

	private FilComponent component() throws FilParseException {
		SourceLocation start = peek().getLocation();
		boolean extern = acceptKeyword("extern");
		expect(FilTokenType.KEYWORD, "comp");
		FilName name = name();

		List<FilName> params = new ArrayList<>();
		if (acceptSymbol("[")) {
			params.add(name());
			while (acceptSymbol(",")) {
				params.add(name());
			}
			expectSymbol("]");
		}

		expectSymbol("<");
		FilName event = name();
		expectSymbol(":");
		FilExpression delay = expression();
		expectSymbol(">");

		List<FilPort> inputs = portList();
		expectSymbol("->");
		List<FilPort> outputs = portList();

		List<FilExistential> existentials = new ArrayList<>();
		if (acceptKeyword("with")) {
			expectSymbol("{");
			while (atKeyword("exists")) {
				existentials.add(existential());
			}
			expectSymbol("}");
		}

		List<FilGuard> guards = acceptKeyword("where") ? guardList() : Collections.emptyList();

		List<FilCommand> body = null;
		if (acceptSymbol(";")) {
			if (!extern) {
				throw new FilParseException(previousLocation(), "component " + name + " needs a body");
			}
		} else {
			if (extern) {
				throw new FilParseException(peek().getLocation(), "extern component " + name + " cannot have a body");
			}
			expectSymbol("{");
			body = new ArrayList<>();
			while (!atSymbol("}")) {
				if (peek().getType() == FilTokenType.EOF) {
					throw unexpected("'}'");
				}
				body.add(command());
			}
			expectSymbol("}");
		}
		return new FilComponent(from(start), name, extern, params, event, delay, inputs, outputs, existentials,
				guards, body);
	}

	private List<FilPort> portList() throws FilParseException {
		expectSymbol("(");
		List<FilPort> ports = new ArrayList<>();
		if (!atSymbol(")")) {
			ports.add(port());
			while (acceptSymbol(",")) {
				ports.add(port());
			}
		}
		expectSymbol(")");
		return ports;
	}

	private FilPort port() throws FilParseException {
		SourceLocation start = peek().getLocation();
		FilName name = name();
		expectSymbol(":");
		if (acceptKeyword("interface")) {
			expectSymbol("[");
			FilExpression time = expression();
			expectSymbol("]");
			return FilPort.interfacePort(from(start), name, time);
		}
		expectSymbol("[");
		FilExpression intervalStart = expression();
		expectSymbol(",");
		FilExpression intervalEnd = expression();
		expectSymbol("]");
		FilExpression width = expression();
		return FilPort.dataPort(from(start), name, intervalStart, intervalEnd, width);
	}

	private FilExistential existential() throws FilParseException {
		SourceLocation start = expect(FilTokenType.KEYWORD, "exists").getLocation();
		FilName name = name();
		FilExpression definition = acceptSymbol("=") ? expression() : null;
		List<FilGuard> guards = acceptKeyword("where") ? guardList() : Collections.emptyList();
		expectSymbol(";");
		return new FilExistential(from(start), name, definition, guards);
	}

	private List<FilGuard> guardList() throws FilParseException {
		List<FilGuard> guards = new ArrayList<>();
		guards.add(guard());
		while (acceptSymbol(",")) {
			guards.add(guard());
		}
		return guards;
	}

	private FilGuard guard() throws FilParseException {
		SourceLocation start = peek().getLocation();
		FilExpression lhs = expression();
		FilGuard.Operator operator = null;
		for (FilGuard.Operator candidate : FilGuard.Operator.values()) {
			if (atSymbol(candidate.getSymbol())) {
				operator = candidate;
			}
		}
		if (operator == null) {
			throw unexpected("a comparison");
		}
		next();
		FilExpression rhs = expression();
		return new FilGuard(from(start), lhs, operator, rhs);
	}

	private FilCommand command() throws FilParseException {
		SourceLocation start = peek().getLocation();
		if (acceptKeyword("exists")) {
			FilName name = name();
			expectSymbol("=");
			FilExpression value = expression();
			expectSymbol(";");
			return new FilExistentialDefinition(from(start), name, value);
		}
		FilName name = name();
		if (acceptSymbol("=")) {
			FilPortRef source = portRef();
			expectSymbol(";");
			return new FilOutputBinding(from(start), name, source);
		}
		expectSymbol(":=");
		if (acceptKeyword("new")) {
			FilName component = name();
			List<FilExpression> args = new ArrayList<>();
			if (acceptSymbol("[")) {
				args.add(expression());
				while (acceptSymbol(",")) {
					args.add(expression());
				}
				expectSymbol("]");
			}
			expectSymbol(";");
			return new FilInstance(from(start), name, component, args);
		}
		FilName instance = name();
		expectSymbol("<");
		FilExpression time = expression();
		expectSymbol(">");
		expectSymbol("(");
		List<FilPortRef> args = new ArrayList<>();
		if (!atSymbol(")")) {
			args.add(portRef());
			while (acceptSymbol(",")) {
				args.add(portRef());
			}
		}
		expectSymbol(")");
		expectSymbol(";");
		return new FilInvocation(from(start), name, instance, time, args);
	}

	private FilPortRef portRef() throws FilParseException {
		SourceLocation start = peek().getLocation();
		if (peek().getType() == FilTokenType.NUMBER) {
			long value = number();
			return new FilConstantPortRef(from(start), value);
		}
		FilName first = name();
		if (acceptSymbol(".")) {
			FilName port = name();
			return new FilInvocationPortRef(from(start), first, port);
		}
		return new FilThisPortRef(from(start), first);
	}

	private FilExpression expression() throws FilParseException {
		SourceLocation start = peek().getLocation();
		FilExpression lhs = term();
		while (atSymbol("+") || atSymbol("-")) {
			FilBinOp.Operator operator = next().getValue().equals("+") ? FilBinOp.Operator.PLUS : FilBinOp.Operator.MINUS;
			FilExpression rhs = term();
			lhs = new FilBinOp(from(start), operator, lhs, rhs);
		}
		return lhs;
	}

	private FilExpression term() throws FilParseException {
		SourceLocation start = peek().getLocation();
		FilExpression lhs = factor();
		while (acceptSymbol("*")) {
			FilExpression rhs = factor();
			lhs = new FilBinOp(from(start), FilBinOp.Operator.TIMES, lhs, rhs);
		}
		return lhs;
	}

	private FilExpression factor() throws FilParseException {
		SourceLocation start = peek().getLocation();
		if (peek().getType() == FilTokenType.NUMBER) {
			long value = number();
			return new FilNumber(from(start), value);
		}
		if (acceptSymbol("(")) {
			FilExpression inner = expression();
			expectSymbol(")");
			return inner;
		}
		if (peek().getType() == FilTokenType.IDENT) {
			FilName first = name();
			if (atSymbol(".") && peek(1).getType() == FilTokenType.IDENT) {
				next();
				FilName field = name();
				return new FilFieldAccess(from(start), first, field);
			}
			return new FilVariable(first.getLocation(), first.getId());
		}
		throw unexpected("an expression");
	}
}
