package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyWith extends PyStatement {

	private final List<PyWithItem> items;
	private final List<PyStatement> body;

	public PyWith(SourceLocation location, List<PyWithItem> items, List<PyStatement> body) {
		super(location);
		this.items = items;
		this.body = body;
	}

	public List<PyWithItem> getItems() {
		return items;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyWith that = (PyWith) o;
		return Objects.equals(items, that.items) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(items, body);
	}
}
