package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * target = target = ... = value
 */
public class PyAssign extends PyStatement {

	private final List<PyExpression> targets;
	private final List<SourceLocation> equalsLocations;
	private final PyExpression value;

	public PyAssign(SourceLocation location, List<PyExpression> targets, List<SourceLocation> equalsLocations, PyExpression value) {
		super(location);
		this.targets = targets;
		this.equalsLocations = equalsLocations;
		this.value = value;
	}

	public List<PyExpression> getTargets() {
		return targets;
	}

	public List<SourceLocation> getEqualsLocations() {
		return equalsLocations;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAssign that = (PyAssign) o;
		return Objects.equals(targets, that.targets) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(targets, value);
	}
}
