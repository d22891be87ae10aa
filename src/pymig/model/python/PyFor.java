package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyFor extends PyStatement {

	private final PyExpression target;
	private final SourceLocation inLocation;
	private final PyExpression iter;
	private final List<PyStatement> body;
	private final List<PyStatement> orelse;
	private final SourceLocation elseLocation;

	public PyFor(SourceLocation location, PyExpression target, SourceLocation inLocation, PyExpression iter, List<PyStatement> body, List<PyStatement> orelse, SourceLocation elseLocation) {
		super(location);
		this.target = target;
		this.inLocation = inLocation;
		this.iter = iter;
		this.body = body;
		this.orelse = orelse;
		this.elseLocation = elseLocation;
	}

	public PyExpression getTarget() {
		return target;
	}

	public SourceLocation getInLocation() {
		return inLocation;
	}

	public PyExpression getIter() {
		return iter;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	public List<PyStatement> getOrelse() {
		return orelse;
	}

	public SourceLocation getElseLocation() {
		return elseLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyFor that = (PyFor) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(iter, that.iter) &&
				Objects.equals(body, that.body) &&
				Objects.equals(orelse, that.orelse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, iter, body, orelse);
	}
}
