package pymig.lexer;

import pymig.PyMigException;
import pymig.util.SourceLocation;

public class PyMigLexerException extends PyMigException {

	private static final String prefix = "Lexer Error";

	public PyMigLexerException(SourceLocation location, String msg) {
		super(prefix, msg, location);
	}

}
