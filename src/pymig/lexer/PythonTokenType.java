package pymig.lexer;

public enum PythonTokenType {
	NAME,
	NUMBER,
	STRING,
	OP,
	NEWLINE,
	INDENT,
	DEDENT,
	ENDMARKER,
}
