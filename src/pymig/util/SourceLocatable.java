package pymig.util;

/**
 * A common abstract base for anything that should be traced back to its original location,
 * typically syntax tree nodes and tokens.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
