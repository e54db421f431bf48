package filament.lexer;

import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class FilLexerTest {

	private static List<FilToken> lex(String input) throws FilLexerException {
		return new FilLexer(Paths.get("test.fil"), input).readTokens();
	}

	private static List<String> values(List<FilToken> tokens) {
		return tokens.stream().map(FilToken::getValue).collect(Collectors.toList());
	}

	@Test
	public void testLongestSymbolWins() throws FilLexerException {
		List<FilToken> tokens = lex("x := m<G+1>(a) -> >= <=");
		assertThat(values(tokens), is(Arrays.asList(
				"x", ":=", "m", "<", "G", "+", "1", ">", "(", "a", ")", "->", ">=", "<=", "")));
		assertThat(tokens.get(1).getType(), is(FilTokenType.SYMBOL));
		assertThat(tokens.get(tokens.size() - 1).getType(), is(FilTokenType.EOF));
	}

	@Test
	public void testKeywordsAndIdentifiers() throws FilLexerException {
		List<FilToken> tokens = lex("extern comp Mul exists L_2 interface");
		assertThat(tokens.get(0).getType(), is(FilTokenType.KEYWORD));
		assertThat(tokens.get(1).getType(), is(FilTokenType.KEYWORD));
		assertThat(tokens.get(2).getType(), is(FilTokenType.IDENT));
		assertThat(tokens.get(3).getType(), is(FilTokenType.KEYWORD));
		assertThat(tokens.get(4).getType(), is(FilTokenType.IDENT));
		assertThat(tokens.get(5).getType(), is(FilTokenType.KEYWORD));
	}

	@Test
	public void testCommentsAreSkipped() throws FilLexerException {
		List<FilToken> tokens = lex("a // line comment\n/* block\ncomment */ b");
		assertThat(values(tokens), is(Arrays.asList("a", "b", "")));
		assertThat(tokens.get(1).getLocation().getStartLine(), is(2));
		assertThat(tokens.get(1).getLocation().getStartColumn(), is(11));
	}

	@Test
	public void testStringsDropQuotes() throws FilLexerException {
		List<FilToken> tokens = lex("import \"lib/mul.fil\";");
		assertThat(tokens.get(1).getType(), is(FilTokenType.STRING));
		assertThat(tokens.get(1).getValue(), is("lib/mul.fil"));
	}

	@Test
	public void testUnterminatedComment() {
		try {
			lex("a /* never closed");
			fail("expected a lexer error");
		} catch (FilLexerException e) {
			assertThat(e.getMessage().contains("unterminated comment"), is(true));
		}
	}

	@Test
	public void testUnexpectedCharacter() {
		try {
			lex("a $ b");
			fail("expected a lexer error");
		} catch (FilLexerException e) {
			assertThat(e.getLocation().getStartColumn(), is(2));
		}
	}
}
