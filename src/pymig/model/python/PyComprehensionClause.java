package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * for target in iter if ifs...
 */
public class PyComprehensionClause extends PyNode {

	private final PyExpression target;
	private final PyExpression iter;
	private final List<PyExpression> ifs;

	public PyComprehensionClause(SourceLocation location, PyExpression target, PyExpression iter, List<PyExpression> ifs) {
		super(location);
		this.target = target;
		this.iter = iter;
		this.ifs = ifs;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyExpression getIter() {
		return iter;
	}

	public List<PyExpression> getIfs() {
		return ifs;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyComprehensionClause that = (PyComprehensionClause) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(iter, that.iter) &&
				Objects.equals(ifs, that.ifs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, iter, ifs);
	}
}
