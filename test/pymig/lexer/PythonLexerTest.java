package pymig.lexer;

import org.junit.Test;
import pymig.model.python.PyTrivia;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class PythonLexerTest {

	private static PythonLexer lexer(String source) {
		return new PythonLexer(Paths.get("test.py"), source);
	}

	private static List<PythonTokenType> types(List<PythonToken> tokens) {
		List<PythonTokenType> types = new ArrayList<>();
		for (PythonToken token : tokens) {
			types.add(token.getType());
		}
		return types;
	}

	private static List<String> values(List<PythonToken> tokens) {
		List<String> values = new ArrayList<>();
		for (PythonToken token : tokens) {
			values.add(token.getValue());
		}
		return values;
	}

	@Test
	public void testBlockStructure() {
		List<PythonToken> tokens = lexer("if x:\n    y = 1  # c\n\n    # only a comment\nz\n").readTokens();
		assertThat(types(tokens), is(Arrays.asList(
				PythonTokenType.NAME, PythonTokenType.NAME, PythonTokenType.OP, PythonTokenType.NEWLINE,
				PythonTokenType.INDENT, PythonTokenType.NAME, PythonTokenType.OP, PythonTokenType.NUMBER,
				PythonTokenType.NEWLINE, PythonTokenType.DEDENT, PythonTokenType.NAME, PythonTokenType.NEWLINE,
				PythonTokenType.ENDMARKER)));
	}

	@Test
	public void testImplicitAndExplicitJoins() {
		PythonLexer lexer = lexer("x = (1,\n     2) + \\\n    3\n");
		List<PythonToken> tokens = lexer.readTokens();
		assertThat(values(tokens), is(Arrays.asList("x", "=", "(", "1", ",", "2", ")", "+", "3", "\n", "")));
		List<PyTrivia> trivia = lexer.getTrivia();
		assertThat(trivia.size(), is(1));
		assertThat(trivia.get(0).getKind(), is(PyTrivia.Kind.LINE_JOIN));
		assertThat(trivia.get(0).getLocation().getStartLine(), is(2));
		assertThat(trivia.get(0).getLocation().getStartColumn(), is(10));
	}

	@Test
	public void testTrivia() {
		PythonLexer lexer = lexer("a = 1; b = 2  # two\n# three\n");
		lexer.readTokens();
		List<PyTrivia> trivia = lexer.getTrivia();
		assertThat(trivia.size(), is(3));
		assertThat(trivia.get(0).getKind(), is(PyTrivia.Kind.SEMICOLON));
		assertThat(trivia.get(0).getLocation().getStartColumn(), is(5));
		assertThat(trivia.get(1).getKind(), is(PyTrivia.Kind.COMMENT));
		assertThat(trivia.get(1).getText(), is("# two"));
		assertThat(trivia.get(2).getText(), is("# three"));
		assertThat(trivia.get(2).getLocation().getStartLine(), is(2));
	}

	@Test
	public void testStrings() {
		List<PythonToken> tokens = lexer("s = rb'\\d' f\"{x}\" '''a\n'b'''\n").readTokens();
		assertThat(values(tokens).subList(2, 5), is(Arrays.asList("rb'\\d'", "f\"{x}\"", "'''a\n'b'''")));
		assertThat(tokens.get(4).getType(), is(PythonTokenType.STRING));
		assertThat(tokens.get(4).getLocation().getEndLine(), is(2));
	}

	@Test
	public void testNumbers() {
		List<PythonToken> tokens = lexer("0x_ff 1_000.5e-3j .5 7\n").readTokens();
		assertThat(values(tokens).subList(0, 4), is(Arrays.asList("0x_ff", "1_000.5e-3j", ".5", "7")));
	}

	@Test
	public void testOperatorsLongestFirst() {
		List<PythonToken> tokens = lexer("a **= b // c -> d\n").readTokens();
		assertThat(values(tokens).subList(0, 7), is(Arrays.asList("a", "**=", "b", "//", "c", "->", "d")));
	}

	@Test
	public void testLineEndingsAreNormalised() {
		PythonLexer lexer = lexer("a\r\nb\rc\n");
		assertThat(lexer.getText(), is("a\nb\nc\n"));
		assertThat(lexer.readTokens().get(2).getLocation().getStartLine(), is(2));
	}

	@Test(expected = PyMigLexerException.class)
	public void testInconsistentDedent() {
		lexer("if x:\n        y\n    z\n").readTokens();
	}

	@Test(expected = PyMigLexerException.class)
	public void testUnterminatedString() {
		lexer("x = 'abc\n").readTokens();
	}

	@Test(expected = PyMigLexerException.class)
	public void testUnmatchedBracket() {
		lexer("x = 1)\n").readTokens();
	}

}
