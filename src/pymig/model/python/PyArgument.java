package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * A single formal parameter. Located at its first token, which is the star for *args and **kwargs.
 */
public class PyArgument extends PyNode {

	private final String name;
	private final SourceLocation nameLocation;
	private final PyExpression annotation;
	private final SourceLocation equalsLocation;
	private final PyExpression defaultValue;

	public PyArgument(SourceLocation location, String name, SourceLocation nameLocation, PyExpression annotation, SourceLocation equalsLocation, PyExpression defaultValue) {
		super(location);
		this.name = name;
		this.nameLocation = nameLocation;
		this.annotation = annotation;
		this.equalsLocation = equalsLocation;
		this.defaultValue = defaultValue;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getNameLocation() {
		return nameLocation;
	}

	public PyExpression getAnnotation() {
		return annotation;
	}

	public SourceLocation getEqualsLocation() {
		return equalsLocation;
	}

	public PyExpression getDefaultValue() {
		return defaultValue;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyArgument that = (PyArgument) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, annotation, defaultValue);
	}
}
