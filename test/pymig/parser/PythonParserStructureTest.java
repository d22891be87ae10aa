package pymig.parser;

import org.junit.Test;
import pymig.lexer.PythonLexer;
import pymig.model.python.PyAssign;
import pymig.model.python.PyBinOp;
import pymig.model.python.PyExpression;
import pymig.model.python.PyIf;
import pymig.model.python.PyModule;
import pymig.model.python.PyTrivia;
import pymig.util.SourceLocation;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PythonParserStructureTest {

	private static final Path FILE = Paths.get("test.py");

	private static PythonParser parser(String source) {
		return new PythonParser(FILE, new PythonLexer(FILE, source).readTokens());
	}

	@Test
	public void testGroupingParensAreRecorded() {
		PythonParser parser = parser("x = (a +\n     b)\n");
		PyModule module = parser.parseModule();
		PyExpression value = ((PyAssign) module.getBody().get(0)).getValue();
		assertThat(value, instanceOf(PyBinOp.class));
		assertTrue(parser.getGroupedExpressions().contains(value));

		List<PyTrivia> parens = parser.getGroupingParens();
		assertThat(parens.size(), is(2));
		assertThat(parens.get(0).getKind(), is(PyTrivia.Kind.GROUP_OPEN));
		assertThat(parens.get(0).getLocation().getStartLine(), is(1));
		assertThat(parens.get(0).getLocation().getStartColumn(), is(4));
		assertThat(parens.get(1).getKind(), is(PyTrivia.Kind.GROUP_CLOSE));
		assertThat(parens.get(1).getLocation().getStartLine(), is(2));
		assertThat(parens.get(1).getLocation().getStartColumn(), is(6));
	}

	@Test
	public void testTupleParensAreNotGrouping() {
		PythonParser parser = parser("x = (a, b)\ny = ()\n");
		parser.parseModule();
		assertTrue(parser.getGroupingParens().isEmpty());
		assertTrue(parser.getGroupedExpressions().isEmpty());
	}

	@Test
	public void testBinOpLocationSpansOperands() {
		PyModule module = parser("x = 'a%s' % (y,\n             z)\n").parseModule();
		SourceLocation location = ((PyAssign) module.getBody().get(0)).getValue().getLocation();
		assertThat(location.getStartLine(), is(1));
		assertThat(location.getStartColumn(), is(4));
		assertThat(location.getEndLine(), is(2));
		assertThat(location.getEndColumn(), is(15));
	}

	@Test
	public void testElifChain() {
		PyModule module = parser("if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n").parseModule();
		PyIf first = (PyIf) module.getBody().get(0);
		assertFalse(first.isElif());
		assertThat(first.getOrelse().size(), is(1));
		PyIf second = (PyIf) first.getOrelse().get(0);
		assertTrue(second.isElif());
		assertThat(second.getLocation().getStartLine(), is(3));
		assertThat(second.getOrelse().size(), is(1));
	}

	@Test(expected = PythonParseException.class)
	public void testMissingOperand() {
		parser("x = 1 +\n").parseModule();
	}

	@Test(expected = PythonParseException.class)
	public void testUnexpectedIndent() {
		parser("x = 1\n    y = 2\n").parseModule();
	}

	@Test
	public void testErrorLocation() {
		try {
			parser("def f(:):\n    pass\n").parseModule();
		} catch (PythonParseException e) {
			assertThat(e.getLocation().getStartLine(), is(1));
			assertThat(e.getLocation().getStartColumn(), is(6));
			return;
		}
		throw new AssertionError("expected a parse error");
	}

}
