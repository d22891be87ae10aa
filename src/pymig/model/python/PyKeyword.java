package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * A keyword argument of a call or class definition; the name is null for **kwargs.
 */
public class PyKeyword extends PyNode {

	private final String name;
	private final PyExpression value;

	public PyKeyword(SourceLocation location, String name, PyExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyKeyword that = (PyKeyword) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}
}
