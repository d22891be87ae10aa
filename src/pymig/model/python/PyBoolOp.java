package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A chain of the same boolean operator: values[0] op values[1] op ...
 */
public class PyBoolOp extends PyExpression {

	private final Operation op;
	private final List<PyExpression> values;
	private final List<SourceLocation> operatorLocations;

	public enum Operation {
		AND("and"),
		OR("or"),
		;

		private final String symbol;

		Operation(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public PyBoolOp(SourceLocation location, Operation op, List<PyExpression> values,
	                List<SourceLocation> operatorLocations) {
		super(location);
		this.op = op;
		this.values = values;
		this.operatorLocations = operatorLocations;
	}

	public Operation getOperation() {
		return op;
	}

	public List<PyExpression> getValues() {
		return values;
	}

	public List<SourceLocation> getOperatorLocations() {
		return operatorLocations;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyBoolOp boolOp = (PyBoolOp) o;
		return op == boolOp.op &&
				Objects.equals(values, boolOp.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(op, values);
	}
}
