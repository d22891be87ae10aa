package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyImport extends PyStatement {

	private final List<PyAlias> names;

	public PyImport(SourceLocation location, List<PyAlias> names) {
		super(location);
		this.names = names;
	}

	public List<PyAlias> getNames() {
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
		PyImport that = (PyImport) o;
		return Objects.equals(names, that.names);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names);
	}
}
