package pymig.parser;

import pymig.PyMigException;
import pymig.util.SourceLocation;

/**
 * An exception for Python syntax errors
 *
 */
public class PythonParseException extends PyMigException {

	private static final long serialVersionUID = -2250473360964207131L;
	private static final String prefix = "Parse Error";

	public PythonParseException(SourceLocation location, String msg) {
		super(prefix, msg, location);
	}
}
