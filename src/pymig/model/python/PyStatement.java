package pymig.model.python;

import pymig.util.SourceLocation;

public abstract class PyStatement extends PyNode {

	public PyStatement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
