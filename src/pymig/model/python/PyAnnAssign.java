package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyAnnAssign extends PyStatement {

	private final PyExpression target;
	private final PyExpression annotation;
	private final PyExpression value;

	public PyAnnAssign(SourceLocation location, PyExpression target, PyExpression annotation, PyExpression value) {
		super(location);
		this.target = target;
		this.annotation = annotation;
		this.value = value;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyExpression getAnnotation() {
		return annotation;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAnnAssign that = (PyAnnAssign) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, annotation, value);
	}
}
