package pymig.trans;

import pymig.PyMigException;

/**
 * Exception during the migration of a Python module
 *
 */
public class PyMigTransException extends PyMigException {

	private static final long serialVersionUID = 4518920744317254311L;
	private static final String prefix = "Migration Error";

	public PyMigTransException(String msg) {
		super(prefix, msg);
	}

}
