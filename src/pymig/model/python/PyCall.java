package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyCall extends PyExpression {

	private final PyExpression function;
	private final SourceLocation openLocation;
	private final List<PyExpression> arguments;
	private final List<PyKeyword> keywords;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;

	public PyCall(SourceLocation location, PyExpression function, SourceLocation openLocation, List<PyExpression> arguments, List<PyKeyword> keywords, SourceLocation closeLocation, boolean trailingComma) {
		super(location);
		this.function = function;
		this.openLocation = openLocation;
		this.arguments = arguments;
		this.keywords = keywords;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
	}

	public PyExpression getFunction() {
		return function;
	}

	public SourceLocation getOpenLocation() {
		return openLocation;
	}

	public List<PyExpression> getArguments() {
		return arguments;
	}

	public List<PyKeyword> getKeywords() {
		return keywords;
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
		PyCall that = (PyCall) o;
		return Objects.equals(function, that.function) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(keywords, that.keywords) &&
				trailingComma == that.trailingComma;
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments, keywords, trailingComma);
	}
}
