package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * The formal parameter list of a function definition or lambda:
 *
 * positional, *vararg, keywordOnly, **kwarg
 *
 * A bare "*" separator is recorded by its location alone. The closing parenthesis is only known for
 * function definitions.
 */
public class PyArguments extends PyNode {

	private final List<PyArgument> positional;
	private final PyArgument vararg;
	private final SourceLocation bareStarLocation;
	private final List<PyArgument> keywordOnly;
	private final PyArgument kwarg;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;

	public PyArguments(SourceLocation location, List<PyArgument> positional, PyArgument vararg,
	                   SourceLocation bareStarLocation, List<PyArgument> keywordOnly, PyArgument kwarg,
	                   SourceLocation closeLocation, boolean trailingComma) {
		super(location);
		this.positional = positional;
		this.vararg = vararg;
		this.bareStarLocation = bareStarLocation;
		this.keywordOnly = keywordOnly;
		this.kwarg = kwarg;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
	}

	public List<PyArgument> getPositional() {
		return positional;
	}

	public PyArgument getVararg() {
		return vararg;
	}

	public SourceLocation getBareStarLocation() {
		return bareStarLocation;
	}

	public boolean hasBareStar() {
		return bareStarLocation != null;
	}

	public List<PyArgument> getKeywordOnly() {
		return keywordOnly;
	}

	public PyArgument getKwarg() {
		return kwarg;
	}

	public SourceLocation getCloseLocation() {
		return closeLocation;
	}

	public boolean isTrailingComma() {
		return trailingComma;
	}

	public boolean isEmpty() {
		return positional.isEmpty() && vararg == null && bareStarLocation == null && keywordOnly.isEmpty()
				&& kwarg == null;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyArguments that = (PyArguments) o;
		return trailingComma == that.trailingComma &&
				(bareStarLocation == null) == (that.bareStarLocation == null) &&
				Objects.equals(positional, that.positional) &&
				Objects.equals(vararg, that.vararg) &&
				Objects.equals(keywordOnly, that.keywordOnly) &&
				Objects.equals(kwarg, that.kwarg);
	}

	@Override
	public int hashCode() {
		return Objects.hash(positional, vararg, bareStarLocation == null, keywordOnly, kwarg, trailingComma);
	}
}
