package pymig.model.python;

import pymig.formatters.PyNodeFormattingVisitor;
import pymig.util.SourceLocatable;
import pymig.util.SourceLocation;

/**
 *
 * The base class for any Python AST node. Every node knows where it came from in the
 * source, which is what lets a printer put it back in the same place.
 *
 * Equality is structural and ignores source locations.
 *
 */
public abstract class PyNode extends SourceLocatable {
	private final SourceLocation location;

	public PyNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the node kind and its location, e.g. "PyBinOp 3:4"
	 */
	public String describe() {
		return getClass().getSimpleName() + " " + location.shortString();
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		return PyNodeFormattingVisitor.format(this);
	}

	public abstract <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E;

}
