package pymig.parser;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import pymig.lexer.PythonLexer;
import pymig.model.python.PyBinOp;
import pymig.model.python.PyBoolOp;
import pymig.model.python.PyCompare;
import pymig.model.python.PyModule;
import pymig.model.python.PyUnaryOp;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static pymig.model.python.PyBuilder.*;

@RunWith(Parameterized.class)
public class PythonParserTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						"x = 1\n",
						module(assign(name("x"), num("1"))),
				},
				{
						"print('%s %s' % (a, b))\n",
						module(expr(call(name("print"),
								binop(PyBinOp.Operation.MOD, str("%s %s"), tuple(name("a"), name("b")))))),
				},
				{
						"a + b * c\n",
						module(expr(binop(PyBinOp.Operation.ADD, name("a"),
								binop(PyBinOp.Operation.MULT, name("b"), name("c"))))),
				},
				{
						"a - b - c\n",
						module(expr(binop(PyBinOp.Operation.SUB,
								binop(PyBinOp.Operation.SUB, name("a"), name("b")), name("c")))),
				},
				{
						"a ** b ** c\n",
						module(expr(binop(PyBinOp.Operation.POW, name("a"),
								binop(PyBinOp.Operation.POW, name("b"), name("c"))))),
				},
				{
						"-a ** b\n",
						module(expr(unary(PyUnaryOp.Operation.USUB,
								binop(PyBinOp.Operation.POW, name("a"), name("b"))))),
				},
				{
						"a ** -b\n",
						module(expr(binop(PyBinOp.Operation.POW, name("a"),
								unary(PyUnaryOp.Operation.USUB, name("b"))))),
				},
				{
						"not a in b\n",
						module(expr(unary(PyUnaryOp.Operation.NOT,
								compare(name("a"), PyCompare.Operation.IN, name("b"))))),
				},
				{
						"a is not b\n",
						module(expr(compare(name("a"), PyCompare.Operation.IS_NOT, name("b")))),
				},
				{
						"a or b and not c\n",
						module(expr(boolop(PyBoolOp.Operation.OR, name("a"),
								boolop(PyBoolOp.Operation.AND, name("b"), unary(PyUnaryOp.Operation.NOT, name("c")))))),
				},
				{
						"x = a if b else c\n",
						module(assign(name("x"), ifExp(name("a"), name("b"), name("c")))),
				},
				{
						"f = lambda x, y: x\n",
						module(assign(name("f"), lambda(name("x"), "x", "y"))),
				},
				{
						"(a + b).c()\n",
						module(expr(call(attribute(binop(PyBinOp.Operation.ADD, name("a"), name("b")), "c")))),
				},
				{
						"x = ('a'\n     \"b\")\n",
						module(assign(name("x"), str("ab"))),
				},
				{
						"x = [1, (2)]\n",
						module(assign(name("x"), list(num("1"), num("2")))),
				},
		});
	}

	private final String source;
	private final PyModule expected;

	public PythonParserTest(String source, PyModule expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		PythonLexer lexer = new PythonLexer(Paths.get("test.py"), source);
		PythonParser parser = new PythonParser(Paths.get("test.py"), lexer.readTokens());
		assertThat(parser.parseModule(), is(expected));
	}

}
