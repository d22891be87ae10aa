package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyAttribute extends PyExpression {

	private final PyExpression value;
	private final String attribute;
	private final SourceLocation attributeLocation;

	public PyAttribute(SourceLocation location, PyExpression value, String attribute, SourceLocation attributeLocation) {
		super(location);
		this.value = value;
		this.attribute = attribute;
		this.attributeLocation = attributeLocation;
	}

	public PyExpression getValue() {
		return value;
	}

	public String getAttribute() {
		return attribute;
	}

	public SourceLocation getAttributeLocation() {
		return attributeLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAttribute that = (PyAttribute) o;
		return Objects.equals(value, that.value) &&
				Objects.equals(attribute, that.attribute);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, attribute);
	}
}
