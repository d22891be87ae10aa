package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * lhs <op> rhs
 *
 */
public class PyBinOp extends PyExpression {

	private final Operation op;
	private final SourceLocation operatorLocation;
	private final PyExpression lhs;
	private final PyExpression rhs;

	public enum Operation {
		BIT_OR("|"),
		BIT_XOR("^"),
		BIT_AND("&"),

		LSHIFT("<<"),
		RSHIFT(">>"),

		ADD("+"),
		SUB("-"),

		MULT("*"),
		MAT_MULT("@"),
		DIV("/"),
		FLOOR_DIV("//"),
		MOD("%"),

		POW("**"),
		;

		private final String symbol;

		Operation(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		public static Operation fromSymbol(String symbol) {
			for (Operation op : values()) {
				if (op.symbol.equals(symbol)) {
					return op;
				}
			}
			return null;
		}
	}

	public PyBinOp(SourceLocation location, Operation op, SourceLocation operatorLocation, PyExpression lhs,
	               PyExpression rhs) {
		super(location);
		this.op = op;
		this.operatorLocation = operatorLocation;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operation getOperation() {
		return op;
	}

	public SourceLocation getOperatorLocation() {
		return operatorLocation;
	}

	public PyExpression getLHS() {
		return lhs;
	}

	public PyExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyBinOp binOp = (PyBinOp) o;
		return op == binOp.op &&
				Objects.equals(lhs, binOp.lhs) &&
				Objects.equals(rhs, binOp.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, lhs, rhs);
	}
}
