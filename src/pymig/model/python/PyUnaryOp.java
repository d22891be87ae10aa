package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyUnaryOp extends PyExpression {

	private final Operation op;
	private final PyExpression operand;

	public enum Operation {
		UADD("+"),
		USUB("-"),
		INVERT("~"),
		NOT("not"),
		;

		private final String symbol;

		Operation(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public PyUnaryOp(SourceLocation location, Operation op, PyExpression operand) {
		super(location);
		this.op = op;
		this.operand = operand;
	}

	public Operation getOperation() {
		return op;
	}

	public PyExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyUnaryOp unaryOp = (PyUnaryOp) o;
		return op == unaryOp.op &&
				Objects.equals(operand, unaryOp.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, operand);
	}
}
