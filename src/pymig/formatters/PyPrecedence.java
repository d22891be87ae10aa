package pymig.formatters;

import pymig.Unreachable;
import pymig.model.python.PyBinOp;
import pymig.model.python.PyBoolOp;
import pymig.model.python.PyUnaryOp;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binding strength of Python operators; higher binds tighter. Every operator has an entry.
 */
public final class PyPrecedence {

	public static final int LAMBDA = 0;
	public static final int CONDITIONAL = 1;
	public static final int OR = 2;
	public static final int AND = 3;
	public static final int NOT = 4;
	public static final int COMPARISON = 5;
	public static final int BIT_OR = 6;
	public static final int BIT_XOR = 7;
	public static final int BIT_AND = 8;
	public static final int SHIFT = 9;
	public static final int ADDITIVE = 10;
	public static final int MULTIPLICATIVE = 11;
	public static final int UNARY = 12;
	public static final int POWER = 13;
	public static final int AWAIT = 14;
	public static final int POSTFIX = 15;
	public static final int DISPLAY = 16;

	private static final Map<PyBinOp.Operation, Integer> binaryPrecedence = new EnumMap<>(PyBinOp.Operation.class);
	private static final Map<PyBoolOp.Operation, Integer> booleanPrecedence = new EnumMap<>(PyBoolOp.Operation.class);
	private static final Map<PyUnaryOp.Operation, Integer> unaryPrecedence = new EnumMap<>(PyUnaryOp.Operation.class);
	static {
		binaryPrecedence.put(PyBinOp.Operation.BIT_OR, BIT_OR);
		binaryPrecedence.put(PyBinOp.Operation.BIT_XOR, BIT_XOR);
		binaryPrecedence.put(PyBinOp.Operation.BIT_AND, BIT_AND);
		// <<  >>
		for (PyBinOp.Operation op : Arrays.asList(PyBinOp.Operation.LSHIFT, PyBinOp.Operation.RSHIFT)) {
			binaryPrecedence.put(op, SHIFT);
		}
		// +  -
		for (PyBinOp.Operation op : Arrays.asList(PyBinOp.Operation.ADD, PyBinOp.Operation.SUB)) {
			binaryPrecedence.put(op, ADDITIVE);
		}
		// *  @  /  //  %
		for (PyBinOp.Operation op : Arrays.asList(
				PyBinOp.Operation.MULT, PyBinOp.Operation.MAT_MULT, PyBinOp.Operation.DIV,
				PyBinOp.Operation.FLOOR_DIV, PyBinOp.Operation.MOD)) {
			binaryPrecedence.put(op, MULTIPLICATIVE);
		}
		binaryPrecedence.put(PyBinOp.Operation.POW, POWER);

		booleanPrecedence.put(PyBoolOp.Operation.OR, OR);
		booleanPrecedence.put(PyBoolOp.Operation.AND, AND);

		// +x  -x  ~x
		for (PyUnaryOp.Operation op : Arrays.asList(
				PyUnaryOp.Operation.UADD, PyUnaryOp.Operation.USUB, PyUnaryOp.Operation.INVERT)) {
			unaryPrecedence.put(op, UNARY);
		}
		unaryPrecedence.put(PyUnaryOp.Operation.NOT, NOT);

		checkTotal(binaryPrecedence, PyBinOp.Operation.class);
		checkTotal(booleanPrecedence, PyBoolOp.Operation.class);
		checkTotal(unaryPrecedence, PyUnaryOp.Operation.class);
	}

	private static <K extends Enum<K>> void checkTotal(Map<K, Integer> table, Class<K> operations) {
		for (K op : operations.getEnumConstants()) {
			if (!table.containsKey(op)) {
				throw new Unreachable("no precedence for " + operations.getSimpleName() + "." + op.name());
			}
		}
	}

	private PyPrecedence() {}

	public static int of(PyBinOp.Operation op) {
		return binaryPrecedence.get(op);
	}

	public static int of(PyBoolOp.Operation op) {
		return booleanPrecedence.get(op);
	}

	public static int of(PyUnaryOp.Operation op) {
		return unaryPrecedence.get(op);
	}

	/**
	 * @return the level an operand of op must reach to go without parentheses
	 */
	public static int leftOperand(PyBinOp.Operation op) {
		return op == PyBinOp.Operation.POW ? AWAIT : of(op);
	}

	public static int rightOperand(PyBinOp.Operation op) {
		return op == PyBinOp.Operation.POW ? UNARY : of(op) + 1;
	}

	public static int operand(PyUnaryOp.Operation op) {
		return op == PyUnaryOp.Operation.NOT ? NOT : UNARY;
	}

}
