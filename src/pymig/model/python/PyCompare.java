package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 *
 * AST node:
 *
 * left op[0] comparators[0] op[1] comparators[1] ...
 *
 */
public class PyCompare extends PyExpression {

	private final PyExpression left;
	private final List<Operation> ops;
	private final List<SourceLocation> operatorLocations;
	private final List<PyExpression> comparators;

	public enum Operation {
		EQ("=="),
		NOT_EQ("!="),
		LT("<"),
		LT_E("<="),
		GT(">"),
		GT_E(">="),
		IS("is"),
		IS_NOT("is not"),
		IN("in"),
		NOT_IN("not in"),
		;

		private final String symbol;

		Operation(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public PyCompare(SourceLocation location, PyExpression left, List<Operation> ops,
	                 List<SourceLocation> operatorLocations, List<PyExpression> comparators) {
		super(location);
		this.left = left;
		this.ops = ops;
		this.operatorLocations = operatorLocations;
		this.comparators = comparators;
	}

	public PyExpression getLeft() {
		return left;
	}

	public List<Operation> getOperations() {
		return ops;
	}

	public List<SourceLocation> getOperatorLocations() {
		return operatorLocations;
	}

	public List<PyExpression> getComparators() {
		return comparators;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyCompare compare = (PyCompare) o;
		return Objects.equals(left, compare.left) &&
				Objects.equals(ops, compare.ops) &&
				Objects.equals(comparators, compare.comparators);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, ops, comparators);
	}
}
