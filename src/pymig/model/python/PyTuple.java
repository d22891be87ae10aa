package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A tuple. A parenthesized tuple is located from its opening parenthesis, a bare one from its first element.
 */
public class PyTuple extends PyExpression {

	private final List<PyExpression> elements;
	private final boolean parenthesized;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;

	public PyTuple(SourceLocation location, List<PyExpression> elements, boolean parenthesized, SourceLocation closeLocation, boolean trailingComma) {
		super(location);
		this.elements = elements;
		this.parenthesized = parenthesized;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
	}

	public List<PyExpression> getElements() {
		return elements;
	}

	public boolean isParenthesized() {
		return parenthesized;
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
		PyTuple that = (PyTuple) o;
		return Objects.equals(elements, that.elements) &&
				parenthesized == that.parenthesized &&
				trailingComma == that.trailingComma;
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements, parenthesized, trailingComma);
	}
}
