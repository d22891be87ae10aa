package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyDelete extends PyStatement {

	private final List<PyExpression> targets;

	public PyDelete(SourceLocation location, List<PyExpression> targets) {
		super(location);
		this.targets = targets;
	}

	public List<PyExpression> getTargets() {
		return targets;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyDelete that = (PyDelete) o;
		return Objects.equals(targets, that.targets);
	}

	@Override
	public int hashCode() {
		return Objects.hash(targets);
	}
}
