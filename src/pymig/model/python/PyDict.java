package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A dict display. Keys are null for ** entries.
 */
public class PyDict extends PyExpression {

	private final List<PyExpression> keys;
	private final List<PyExpression> values;
	private final List<SourceLocation> entryLocations;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;

	public PyDict(SourceLocation location, List<PyExpression> keys, List<PyExpression> values, List<SourceLocation> entryLocations, SourceLocation closeLocation, boolean trailingComma) {
		super(location);
		this.keys = keys;
		this.values = values;
		this.entryLocations = entryLocations;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
	}

	public List<PyExpression> getKeys() {
		return keys;
	}

	public List<PyExpression> getValues() {
		return values;
	}

	public List<SourceLocation> getEntryLocations() {
		return entryLocations;
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
		PyDict that = (PyDict) o;
		return Objects.equals(keys, that.keys) &&
				Objects.equals(values, that.values) &&
				trailingComma == that.trailingComma;
	}

	@Override
	public int hashCode() {
		return Objects.hash(keys, values, trailingComma);
	}
}
