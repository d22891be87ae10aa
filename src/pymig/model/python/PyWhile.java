package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyWhile extends PyStatement {

	private final PyExpression test;
	private final List<PyStatement> body;
	private final List<PyStatement> orelse;
	private final SourceLocation elseLocation;

	public PyWhile(SourceLocation location, PyExpression test, List<PyStatement> body, List<PyStatement> orelse, SourceLocation elseLocation) {
		super(location);
		this.test = test;
		this.body = body;
		this.orelse = orelse;
		this.elseLocation = elseLocation;
	}

	public PyExpression getTest() {
		return test;
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
		PyWhile that = (PyWhile) o;
		return Objects.equals(test, that.test) &&
				Objects.equals(body, that.body) &&
				Objects.equals(orelse, that.orelse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, body, orelse);
	}
}
