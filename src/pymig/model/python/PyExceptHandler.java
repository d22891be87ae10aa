package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyExceptHandler extends PyNode {

	private final PyExpression type;
	private final String name;
	private final SourceLocation nameLocation;
	private final List<PyStatement> body;

	public PyExceptHandler(SourceLocation location, PyExpression type, String name, SourceLocation nameLocation, List<PyStatement> body) {
		super(location);
		this.type = type;
		this.name = name;
		this.nameLocation = nameLocation;
		this.body = body;
	}

	public PyExpression getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getNameLocation() {
		return nameLocation;
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
		PyExceptHandler that = (PyExceptHandler) o;
		return Objects.equals(type, that.type) &&
				Objects.equals(name, that.name) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, name, body);
	}
}
