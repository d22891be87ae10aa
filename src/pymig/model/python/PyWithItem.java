package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyWithItem extends PyNode {

	private final PyExpression context;
	private final PyExpression optionalVars;

	public PyWithItem(SourceLocation location, PyExpression context, PyExpression optionalVars) {
		super(location);
		this.context = context;
		this.optionalVars = optionalVars;
	}

	public PyExpression getContext() {
		return context;
	}

	public PyExpression getOptionalVars() {
		return optionalVars;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyWithItem that = (PyWithItem) o;
		return Objects.equals(context, that.context) &&
				Objects.equals(optionalVars, that.optionalVars);
	}

	@Override
	public int hashCode() {
		return Objects.hash(context, optionalVars);
	}
}
