package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * List, set and dict comprehensions and generator expressions. The value is only present for dict
 * comprehensions.
 */
public class PyComprehension extends PyExpression {

	private final Kind kind;
	private final PyExpression element;
	private final PyExpression value;
	private final List<PyComprehensionClause> clauses;

	public enum Kind {
		LIST,
		SET,
		DICT,
		GENERATOR,
	}

	public PyComprehension(SourceLocation location, Kind kind, PyExpression element, PyExpression value,
	                       List<PyComprehensionClause> clauses) {
		super(location);
		this.kind = kind;
		this.element = element;
		this.value = value;
		this.clauses = clauses;
	}

	public Kind getKind() {
		return kind;
	}

	public PyExpression getElement() {
		return element;
	}

	public PyExpression getValue() {
		return value;
	}

	public List<PyComprehensionClause> getClauses() {
		return clauses;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyComprehension that = (PyComprehension) o;
		return kind == that.kind &&
				Objects.equals(element, that.element) &&
				Objects.equals(value, that.value) &&
				Objects.equals(clauses, that.clauses);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, element, value, clauses);
	}
}
