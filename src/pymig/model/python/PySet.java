package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PySet extends PyExpression {

	private final List<PyExpression> elements;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;

	public PySet(SourceLocation location, List<PyExpression> elements, SourceLocation closeLocation, boolean trailingComma) {
		super(location);
		this.elements = elements;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
	}

	public List<PyExpression> getElements() {
		return elements;
	}

	public SourceLocation getCloseLocation() {
		return closeLocation;
	}

	public boolean isTrailingComma() {
		return trailingComma;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PySet that = (PySet) o;
		return Objects.equals(elements, that.elements) &&
				trailingComma == that.trailingComma;
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements, trailingComma);
	}
}
