package pymig.formatters;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import pymig.model.python.PyBinOp;
import pymig.model.python.PyBoolOp;
import pymig.model.python.PyCompare;
import pymig.model.python.PyNode;
import pymig.model.python.PyUnaryOp;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static pymig.model.python.PyBuilder.*;

/**
 * Built trees have no recorded positions, so everything that keeps them correct comes from the precedence rules.
 */
@RunWith(Parameterized.class)
public class PyNodeFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						binop(PyBinOp.Operation.MULT, binop(PyBinOp.Operation.ADD, name("a"), name("b")), name("c")),
						"(a + b) * c",
				},
				{
						binop(PyBinOp.Operation.ADD, name("a"), binop(PyBinOp.Operation.MULT, name("b"), name("c"))),
						"a + b * c",
				},
				{
						binop(PyBinOp.Operation.SUB, name("a"), binop(PyBinOp.Operation.SUB, name("b"), name("c"))),
						"a - (b - c)",
				},
				{
						binop(PyBinOp.Operation.SUB, binop(PyBinOp.Operation.SUB, name("a"), name("b")), name("c")),
						"a - b - c",
				},
				{
						binop(PyBinOp.Operation.POW, binop(PyBinOp.Operation.POW, name("a"), name("b")), name("c")),
						"(a ** b) ** c",
				},
				{
						binop(PyBinOp.Operation.POW, name("a"), binop(PyBinOp.Operation.POW, name("b"), name("c"))),
						"a ** b ** c",
				},
				{
						unary(PyUnaryOp.Operation.USUB, binop(PyBinOp.Operation.POW, name("a"), name("b"))),
						"-a ** b",
				},
				{
						binop(PyBinOp.Operation.POW, unary(PyUnaryOp.Operation.USUB, name("a")), name("b")),
						"(-a) ** b",
				},
				{
						binop(PyBinOp.Operation.POW, name("a"), unary(PyUnaryOp.Operation.USUB, name("b"))),
						"a ** -b",
				},
				{
						unary(PyUnaryOp.Operation.NOT, boolop(PyBoolOp.Operation.AND, name("a"), name("b"))),
						"not (a and b)",
				},
				{
						unary(PyUnaryOp.Operation.NOT, compare(name("a"), PyCompare.Operation.IN, name("b"))),
						"not a in b",
				},
				{
						boolop(PyBoolOp.Operation.AND, boolop(PyBoolOp.Operation.OR, name("a"), name("b")), name("c")),
						"(a or b) and c",
				},
				{
						boolop(PyBoolOp.Operation.OR, boolop(PyBoolOp.Operation.AND, name("a"), name("b")), name("c")),
						"a and b or c",
				},
				{
						compare(compare(name("a"), PyCompare.Operation.LT, name("b")), PyCompare.Operation.EQ, name("c")),
						"(a < b) == c",
				},
				{
						compare(binop(PyBinOp.Operation.BIT_OR, name("a"), name("b")), PyCompare.Operation.IS_NOT,
								num("1")),
						"a | b is not 1",
				},
				{
						ifExp(lambda(name("x")), name("c"), name("d")),
						"(lambda: x) if c else d",
				},
				{
						ifExp(name("a"), name("c"), ifExp(name("b"), name("d"), name("e"))),
						"a if c else b if d else e",
				},
				{
						ifExp(ifExp(name("a"), name("b"), name("c")), name("d"), name("e")),
						"(a if b else c) if d else e",
				},
				{
						lambda(binop(PyBinOp.Operation.ADD, name("x"), name("y")), "x", "y"),
						"lambda x, y: x + y",
				},
				{
						call(attribute(binop(PyBinOp.Operation.ADD, name("a"), name("b")), "c")),
						"(a + b).c()",
				},
				{
						call(name("f"), binop(PyBinOp.Operation.ADD, name("a"), name("b")), tuple(name("c"))),
						"f(a + b, (c,))",
				},
				{
						list(tuple(name("a"), name("b")), str("it's")),
						"[(a, b), \"it's\"]",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%s!"), name("x")),
						"f'{x}!'",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%r and %s"), tuple(name("x"), call(name("g")))),
						"f'{x!r} and {g()}'",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%s"), tuple(lambda(name("y")))),
						"f'{(lambda: y)}'",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%s"), tuple(ifExp(name("a"), name("b"), name("c")))),
						"f'{a if b else c}'",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%s"), tuple(str("q"))),
						"f'{\"q\"}'",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%s"), tuple(binop(PyBinOp.Operation.MOD, str("%s"), name("y")))),
						"f'{f\"{y}\"}'",
				},
				{
						binop(PyBinOp.Operation.MOD, str("%d"), name("x")),
						"'%d' % x",
				},
				{
						binop(PyBinOp.Operation.MULT, binop(PyBinOp.Operation.MOD, str("%s"), name("x")), num("2")),
						"f'{x}' * 2",
				},
		});
	}

	private final PyNode node;
	private final String expected;

	public PyNodeFormattingVisitorTest(PyNode node, String expected) {
		this.node = node;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(PyNodeFormattingVisitor.format(node), is(expected));
	}

}
