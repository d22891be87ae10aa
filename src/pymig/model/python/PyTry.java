package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PyTry extends PyStatement {

	private final List<PyStatement> body;
	private final List<PyExceptHandler> handlers;
	private final List<PyStatement> orelse;
	private final SourceLocation elseLocation;
	private final List<PyStatement> finalBody;
	private final SourceLocation finallyLocation;

	public PyTry(SourceLocation location, List<PyStatement> body, List<PyExceptHandler> handlers, List<PyStatement> orelse, SourceLocation elseLocation, List<PyStatement> finalBody, SourceLocation finallyLocation) {
		super(location);
		this.body = body;
		this.handlers = handlers;
		this.orelse = orelse;
		this.elseLocation = elseLocation;
		this.finalBody = finalBody;
		this.finallyLocation = finallyLocation;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	public List<PyExceptHandler> getHandlers() {
		return handlers;
	}

	public List<PyStatement> getOrelse() {
		return orelse;
	}

	public SourceLocation getElseLocation() {
		return elseLocation;
	}

	public List<PyStatement> getFinalBody() {
		return finalBody;
	}

	public SourceLocation getFinallyLocation() {
		return finallyLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyTry that = (PyTry) o;
		return Objects.equals(body, that.body) &&
				Objects.equals(handlers, that.handlers) &&
				Objects.equals(orelse, that.orelse) &&
				Objects.equals(finalBody, that.finalBody);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, handlers, orelse, finalBody);
	}
}
