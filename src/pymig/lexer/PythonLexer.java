package pymig.lexer;

import pymig.model.python.PyTrivia;
import pymig.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Python 3 tokenizer in the spirit of CPython's own.
 *
 * Produces NEWLINE/INDENT/DEDENT for the logical line structure, joins lines implicitly inside brackets and
 * explicitly after a backslash, and records everything the parser throws away but a printer needs to keep
 * (comments, statement semicolons, backslash joins) as trivia.
 *
 * Line endings are normalised to "\n" before scanning; offsets refer to the normalised text.
 */
public class PythonLexer {

	static final int TAB_SIZE = 8;

	// longest first, so that a prefix never shadows a longer operator
	static final String[] OPERATORS = {
		"**=", "//=", ">>=", "<<=", "...",
		"->", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
		"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", ":=",
		"+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
		"(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=",
	};

	static final Set<String> STRING_PREFIXES = new HashSet<>(Arrays.asList(
			"r", "u", "b", "br", "rb", "f", "fr", "rf"));

	static final Pattern IDENT = Pattern.compile("[\\p{L}\\p{Nl}_][\\p{L}\\p{Nl}\\p{Mn}\\p{Mc}\\p{Nd}\\p{Pc}]*");

	static final Pattern[] NUMBER = {
		Pattern.compile("0[xX](?:_?[0-9a-fA-F])+"),
		Pattern.compile("0[oO](?:_?[0-7])+"),
		Pattern.compile("0[bB](?:_?[01])+"),
		Pattern.compile("(?:[0-9](?:_?[0-9])*\\.(?:[0-9](?:_?[0-9])*)?|\\.[0-9](?:_?[0-9])*)(?:[eE][+-]?[0-9](?:_?[0-9])*)?[jJ]?"),
		Pattern.compile("[0-9](?:_?[0-9])*[eE][+-]?[0-9](?:_?[0-9])*[jJ]?"),
		Pattern.compile("[0-9](?:_?[0-9])*[jJ]?"),
	};

	private final Path filename;
	private final String text;

	private final List<PythonToken> tokens = new ArrayList<>();
	private final List<PyTrivia> trivia = new ArrayList<>();

	private int pos;
	private int line;
	private int lineStart;

	public PythonLexer(Path filename, CharSequence contents) {
		this.filename = filename;
		this.text = normaliseLineEndings(contents);
	}

	public static String normaliseLineEndings(CharSequence contents) {
		return contents.toString().replace("\r\n", "\n").replace('\r', '\n');
	}

	/**
	 * @return the text the lexer scans, with normalised line endings
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the trivia recorded by the last call to {@link #readTokens()}, in source order
	 */
	public List<PyTrivia> getTrivia() {
		return trivia;
	}

	private int column() {
		return pos - lineStart;
	}

	private SourceLocation here() {
		return new SourceLocation(filename, pos, pos, line, line, column(), column());
	}

	private SourceLocation span(int startOffset, int startLine, int startColumn) {
		return new SourceLocation(filename, startOffset, pos, startLine, line, startColumn, column());
	}

	/**
	 * Advances over text that was already matched, keeping the line bookkeeping in step.
	 */
	private void advance(int count) {
		int end = pos + count;
		while (pos < end) {
			if (text.charAt(pos) == '\n') {
				line++;
				lineStart = pos + 1;
			}
			pos++;
		}
	}

	private PythonToken makeToken(PythonTokenType type, int length) {
		int startOffset = pos;
		int startLine = line;
		int startColumn = column();
		advance(length);
		PythonToken token = new PythonToken(
				text.substring(startOffset, pos), type, span(startOffset, startLine, startColumn));
		tokens.add(token);
		return token;
	}

	private void addEmptyToken(PythonTokenType type) {
		tokens.add(new PythonToken("", type, here()));
	}

	/**
	 * @return the tokens of the whole input, ending in ENDMARKER
	 * @throws PyMigLexerException if the input is not lexically valid Python
	 */
	public List<PythonToken> readTokens() throws PyMigLexerException {
		tokens.clear();
		trivia.clear();
		pos = 0;
		line = 1;
		lineStart = 0;

		Deque<Integer> indents = new ArrayDeque<>();
		indents.push(0);
		int depth = 0;
		boolean atLineStart = true;
		boolean lineHasTokens = false;

		while (pos < text.length()) {
			if (atLineStart && depth == 0) {
				atLineStart = false;
				int width = 0;
				int i = pos;
				while (i < text.length()) {
					char c = text.charAt(i);
					if (c == ' ') {
						width++;
					} else if (c == '\t') {
						width = (width / TAB_SIZE + 1) * TAB_SIZE;
					} else if (c == '\f') {
						width = 0;
					} else {
						break;
					}
					i++;
				}
				if (i >= text.length() || text.charAt(i) == '#' || text.charAt(i) == '\n') {
					// blank lines and comment-only lines do not take part in indentation
					pos = i;
					continue;
				}
				pos = i;
				if (width > indents.peek()) {
					indents.push(width);
					addEmptyToken(PythonTokenType.INDENT);
				} else {
					while (width < indents.peek()) {
						indents.pop();
						addEmptyToken(PythonTokenType.DEDENT);
					}
					if (width != indents.peek()) {
						throw new PyMigLexerException(here(), "unindent does not match any outer indentation level");
					}
				}
				continue;
			}

			char c = text.charAt(pos);
			if (c == ' ' || c == '\t' || c == '\f') {
				pos++;
				continue;
			}
			if (c == '#') {
				int end = text.indexOf('\n', pos);
				if (end == -1) {
					end = text.length();
				}
				int startOffset = pos;
				int startColumn = column();
				pos = end;
				trivia.add(new PyTrivia(span(startOffset, line, startColumn), PyTrivia.Kind.COMMENT,
						text.substring(startOffset, end)));
				continue;
			}
			if (c == '\n') {
				if (depth == 0 && lineHasTokens) {
					makeToken(PythonTokenType.NEWLINE, 1);
					lineHasTokens = false;
				} else {
					advance(1);
				}
				atLineStart = depth == 0;
				continue;
			}
			if (c == '\\') {
				if (pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
					trivia.add(new PyTrivia(new SourceLocation(filename, pos, pos + 1, line, line, column(), column() + 1),
							PyTrivia.Kind.LINE_JOIN, "\\"));
					advance(2);
					continue;
				}
				throw new PyMigLexerException(here(), "unexpected character after line continuation character");
			}

			lineHasTokens = true;

			Matcher m = IDENT.matcher(text);
			m.region(pos, text.length());
			if (m.lookingAt()) {
				String name = m.group();
				if (m.end() < text.length() && isQuote(text.charAt(m.end()))
						&& STRING_PREFIXES.contains(name.toLowerCase())) {
					readString(name.length());
				} else {
					makeToken(PythonTokenType.NAME, name.length());
				}
				continue;
			}
			if (isQuote(c)) {
				readString(0);
				continue;
			}
			if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
				int longest = 0;
				for (Pattern p : NUMBER) {
					Matcher n = p.matcher(text);
					n.region(pos, text.length());
					if (n.lookingAt() && n.end() - pos > longest) {
						longest = n.end() - pos;
					}
				}
				if (longest > 0) {
					makeToken(PythonTokenType.NUMBER, longest);
					continue;
				}
			}
			String op = matchOperator();
			if (op != null) {
				if (op.equals("(") || op.equals("[") || op.equals("{")) {
					depth++;
				} else if (op.equals(")") || op.equals("]") || op.equals("}")) {
					if (depth == 0) {
						throw new PyMigLexerException(here(), "unmatched '" + op + "'");
					}
					depth--;
				}
				PythonToken token = makeToken(PythonTokenType.OP, op.length());
				if (op.equals(";")) {
					trivia.add(new PyTrivia(token.getLocation(), PyTrivia.Kind.SEMICOLON, ";"));
				}
				continue;
			}
			throw new PyMigLexerException(here(), "invalid character '" + c + "'");
		}

		if (depth > 0) {
			throw new PyMigLexerException(here(), "unexpected EOF inside brackets");
		}
		if (lineHasTokens) {
			addEmptyToken(PythonTokenType.NEWLINE);
		}
		while (indents.peek() > 0) {
			indents.pop();
			addEmptyToken(PythonTokenType.DEDENT);
		}
		addEmptyToken(PythonTokenType.ENDMARKER);
		return tokens;
	}

	private static boolean isQuote(char c) {
		return c == '\'' || c == '"';
	}

	private String matchOperator() {
		for (String op : OPERATORS) {
			if (text.startsWith(op, pos)) {
				return op;
			}
		}
		return null;
	}

	private void readString(int prefixLength) throws PyMigLexerException {
		int i = pos + prefixLength;
		char quote = text.charAt(i);
		boolean triple = text.startsWith("" + quote + quote + quote, i);
		i += triple ? 3 : 1;
		while (true) {
			if (i >= text.length()) {
				throw new PyMigLexerException(here(), triple ? "unterminated triple-quoted string literal"
						: "unterminated string literal");
			}
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
			} else if (c == '\n' && !triple) {
				throw new PyMigLexerException(here(), "unterminated string literal");
			} else if (c == quote) {
				if (!triple) {
					i++;
					break;
				}
				if (text.startsWith("" + quote + quote + quote, i)) {
					i += 3;
					break;
				}
				i++;
			} else {
				i++;
			}
		}
		makeToken(PythonTokenType.STRING, Math.min(i, text.length()) - pos);
	}

}
