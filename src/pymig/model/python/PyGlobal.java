package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * global or nonlocal declaration
 */
public class PyGlobal extends PyStatement {

	private final boolean nonlocal;
	private final List<PyName> names;

	public PyGlobal(SourceLocation location, boolean nonlocal, List<PyName> names) {
		super(location);
		this.nonlocal = nonlocal;
		this.names = names;
	}

	public boolean isNonlocal() {
		return nonlocal;
	}

	public List<PyName> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyGlobal that = (PyGlobal) o;
		return nonlocal == that.nonlocal &&
				Objects.equals(names, that.names);
	}

	@Override
	public int hashCode() {
		return Objects.hash(nonlocal, names);
	}
}
