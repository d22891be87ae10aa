package pymig;

/**
 * Thrown where a state the code rules out turns up anyway.
 */
public class Unreachable extends RuntimeException {
	public Unreachable(String what) {
		super("unreachable: " + what);
	}

	public Unreachable(String what, Throwable cause) {
		super("unreachable: " + what, cause);
	}
}
