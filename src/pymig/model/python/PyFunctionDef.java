package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * @decorators
 * def name(arguments) -> returns:
 * 	body
 */
public class PyFunctionDef extends PyStatement {

	private final List<PyDecorator> decorators;
	private final String name;
	private final SourceLocation nameLocation;
	private final PyArguments arguments;
	private final SourceLocation arrowLocation;
	private final PyExpression returns;
	private final List<PyStatement> body;

	public PyFunctionDef(SourceLocation location, List<PyDecorator> decorators, String name, SourceLocation nameLocation, PyArguments arguments, SourceLocation arrowLocation, PyExpression returns, List<PyStatement> body) {
		super(location);
		this.decorators = decorators;
		this.name = name;
		this.nameLocation = nameLocation;
		this.arguments = arguments;
		this.arrowLocation = arrowLocation;
		this.returns = returns;
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

	public PyArguments getArguments() {
		return arguments;
	}

	public SourceLocation getArrowLocation() {
		return arrowLocation;
	}

	public PyExpression getReturns() {
		return returns;
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
		PyFunctionDef that = (PyFunctionDef) o;
		return Objects.equals(decorators, that.decorators) &&
				Objects.equals(name, that.name) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(returns, that.returns) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(decorators, name, arguments, returns, body);
	}
}
