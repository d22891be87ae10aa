package pymig.model.python;

import pymig.util.SourceLocation;

public class PyNameConstant extends PyExpression {

	private final Value value;

	public enum Value {
		TRUE("True"),
		FALSE("False"),
		NONE("None"),
		;

		private final String keyword;

		Value(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	public PyNameConstant(SourceLocation location, Value value) {
		super(location);
		this.value = value;
	}

	public Value getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyNameConstant that = (PyNameConstant) o;
		return value == that.value;
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}
}
