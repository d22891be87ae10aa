package pymig.model.python;

import pymig.util.SourceLocation;

public abstract class PyExpression extends PyNode {

	public PyExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
