package pymig;

import pymig.util.SourceLocation;

/**
 * A PyMig exception consisting of a prefix (type of error) and, when one is known, the place in the Python source
 * it is about.
 */
public abstract class PyMigException extends RuntimeException {
	private final SourceLocation location;
	private final String msg;
	private final String prefix;

	public PyMigException(String prefix, String msg) {
		this(prefix, msg, SourceLocation.unknown());
	}

	public PyMigException(String prefix, String msg, SourceLocation location) {
		super(location.isUnknown() ? prefix + ": " + msg : prefix + ": " + msg + " at " + location.shortString());
		this.prefix = prefix;
		this.msg = msg;
		this.location = location;
	}

	public PyMigException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
		this.location = SourceLocation.unknown();
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public SourceLocation getLocation() {
		return location;
	}
}
