package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyModule extends PyNode {

	private final List<PyStatement> body;

	public PyModule(SourceLocation location, List<PyStatement> body) {
		super(location);
		this.body = body;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyModule that = (PyModule) o;
		return Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body);
	}
}
