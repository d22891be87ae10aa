package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * AST node:
 *
 * lower:upper:step
 */
public class PySlice extends PyExpression {

	private final PyExpression lower;
	private final PyExpression upper;
	private final boolean stepColon;
	private final PyExpression step;

	public PySlice(SourceLocation location, PyExpression lower, PyExpression upper, boolean stepColon, PyExpression step) {
		super(location);
		this.lower = lower;
		this.upper = upper;
		this.stepColon = stepColon;
		this.step = step;
	}

	public PyExpression getLower() {
		return lower;
	}

	public PyExpression getUpper() {
		return upper;
	}

	public boolean isStepColon() {
		return stepColon;
	}

	public PyExpression getStep() {
		return step;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PySlice that = (PySlice) o;
		return Objects.equals(lower, that.lower) &&
				Objects.equals(upper, that.upper) &&
				stepColon == that.stepColon &&
				Objects.equals(step, that.step);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lower, upper, stepColon, step);
	}
}
