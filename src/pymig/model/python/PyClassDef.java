package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * @decorators
 * class name(bases, keywords):
 * 	body
 */
public class PyClassDef extends PyStatement {

	private final List<PyDecorator> decorators;
	private final String name;
	private final SourceLocation nameLocation;
	private final boolean parenthesized;
	private final List<PyExpression> bases;
	private final List<PyKeyword> keywords;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;
	private final List<PyStatement> body;

	public PyClassDef(SourceLocation location, List<PyDecorator> decorators, String name, SourceLocation nameLocation, boolean parenthesized, List<PyExpression> bases, List<PyKeyword> keywords, SourceLocation closeLocation, boolean trailingComma, List<PyStatement> body) {
		super(location);
		this.decorators = decorators;
		this.name = name;
		this.nameLocation = nameLocation;
		this.parenthesized = parenthesized;
		this.bases = bases;
		this.keywords = keywords;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
		this.body = body;
	}

	public List<PyDecorator> getDecorators() {
		return decorators;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getNameLocation() {
		return nameLocation;
	}

	public boolean isParenthesized() {
		return parenthesized;
	}

	public List<PyExpression> getBases() {
		return bases;
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
		PyClassDef that = (PyClassDef) o;
		return Objects.equals(decorators, that.decorators) &&
				Objects.equals(name, that.name) &&
				parenthesized == that.parenthesized &&
				Objects.equals(bases, that.bases) &&
				Objects.equals(keywords, that.keywords) &&
				trailingComma == that.trailingComma &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(decorators, name, parenthesized, bases, keywords, trailingComma, body);
	}
}
