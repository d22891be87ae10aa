package pymig.model.python;

import pymig.util.SourceLocation;

public class PyContinue extends PyStatement {

	public PyContinue(SourceLocation location) {
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
		return PyContinue.class.hashCode();
	}
}
