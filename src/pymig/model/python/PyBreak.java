package pymig.model.python;

import pymig.util.SourceLocation;

public class PyBreak extends PyStatement {

	public PyBreak(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return true;
	}

	@Override
	public int hashCode() {
		return PyBreak.class.hashCode();
	}
}
