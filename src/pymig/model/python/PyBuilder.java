package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shorthands for building trees in code. Nodes get no source position unless one is given with {@link #at}.
 */
public class PyBuilder {

	private PyBuilder() {}

	public static SourceLocation at(int line, int column, int length) {
		return SourceLocation.at(line, column, length);
	}

	public static PyModule module(PyStatement... body) {
		return new PyModule(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static PyExpressionStatement expr(PyExpression value) {
		return new PyExpressionStatement(SourceLocation.unknown(), value);
	}

	public static PyAssign assign(PyExpression target, PyExpression value) {
		return new PyAssign(SourceLocation.unknown(), Collections.singletonList(target), Collections.emptyList(),
				value);
	}

	public static PyReturn ret(PyExpression value) {
		return new PyReturn(SourceLocation.unknown(), value);
	}

	public static PyIf pyIf(PyExpression test, List<PyStatement> body, List<PyStatement> orelse) {
		return new PyIf(SourceLocation.unknown(), test, body, orelse, null, false);
	}

	public static PyPass pass() {
		return new PyPass(SourceLocation.unknown());
	}

	public static PyName name(String id) {
		return new PyName(SourceLocation.unknown(), id);
	}

	public static PyName name(SourceLocation location, String id) {
		return new PyName(location, id);
	}

	public static PyNum num(String text) {
		return new PyNum(SourceLocation.unknown(), text);
	}

	public static PyNum num(SourceLocation location, String text) {
		return new PyNum(location, text);
	}

	public static PyStr str(String value) {
		return new PyStr(SourceLocation.unknown(), value, Collections.emptyList());
	}

	public static PyStr str(SourceLocation location, String value) {
		return new PyStr(location, value, Collections.emptyList());
	}

	public static PyBinOp binop(PyBinOp.Operation op, PyExpression lhs, PyExpression rhs) {
		return binop(SourceLocation.unknown(), op, lhs, rhs);
	}

	public static PyBinOp binop(SourceLocation location, PyBinOp.Operation op, PyExpression lhs, PyExpression rhs) {
		return new PyBinOp(location, op, SourceLocation.unknown(), lhs, rhs);
	}

	public static PyBoolOp boolop(PyBoolOp.Operation op, PyExpression... values) {
		return new PyBoolOp(SourceLocation.unknown(), op, Arrays.asList(values), Collections.emptyList());
	}

	public static PyUnaryOp unary(PyUnaryOp.Operation op, PyExpression operand) {
		return new PyUnaryOp(SourceLocation.unknown(), op, operand);
	}

	public static PyCompare compare(PyExpression left, PyCompare.Operation op, PyExpression right) {
		return new PyCompare(SourceLocation.unknown(), left, Collections.singletonList(op), Collections.emptyList(),
				Collections.singletonList(right));
	}

	public static PyIfExp ifExp(PyExpression body, PyExpression test, PyExpression orelse) {
		return new PyIfExp(SourceLocation.unknown(), body, null, test, null, orelse);
	}

	public static PyLambda lambda(PyExpression body, String... parameters) {
		List<PyArgument> positional = new ArrayList<>();
		for (String parameter : parameters) {
			positional.add(new PyArgument(SourceLocation.unknown(), parameter, SourceLocation.unknown(), null,
					null, null));
		}
		PyArguments arguments = new PyArguments(SourceLocation.unknown(), positional, null, null,
				Collections.emptyList(), null, null, false);
		return new PyLambda(SourceLocation.unknown(), arguments, body);
	}

	public static PyCall call(PyExpression function, PyExpression... arguments) {
		return new PyCall(SourceLocation.unknown(), function, SourceLocation.unknown(), Arrays.asList(arguments),
				Collections.emptyList(), SourceLocation.unknown(), false);
	}

	public static PyAttribute attribute(PyExpression value, String attribute) {
		return new PyAttribute(SourceLocation.unknown(), value, attribute, SourceLocation.unknown());
	}

	public static PyTuple tuple(PyExpression... elements) {
		return new PyTuple(SourceLocation.unknown(), Arrays.asList(elements), true, SourceLocation.unknown(),
				false);
	}

	public static PyList list(PyExpression... elements) {
		return new PyList(SourceLocation.unknown(), Arrays.asList(elements), SourceLocation.unknown(), false);
	}

}
