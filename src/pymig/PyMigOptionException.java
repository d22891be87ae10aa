package pymig;

public class PyMigOptionException extends PyMigException {
	private static final String prefix = "Option Error";

	public PyMigOptionException(String msg) {
		super(prefix, msg);
	}
}
