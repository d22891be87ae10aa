package pymig.util;

/**
 * Python string literal rules: the escaping {@code repr} applies, canonical quoting, and decoding of
 * string tokens.
 */
public final class PyStrings {

	private PyStrings() {}

	/**
	 * The body of the Python {@code repr} of {@code '"' + s} without its first two and last characters, that is
	 * s escaped for a single-quoted literal.
	 */
	public static String escape(String s) {
		return escape(s, '\'');
	}

	public static String escape(String s, char quote) {
		StringBuilder out = new StringBuilder(s.length());
		int i = 0;
		while (i < s.length()) {
			int cp = s.codePointAt(i);
			i += Character.charCount(cp);
			if (cp == '\\') {
				out.append("\\\\");
			} else if (cp == quote) {
				out.append('\\').append(quote);
			} else if (cp == '\t') {
				out.append("\\t");
			} else if (cp == '\n') {
				out.append("\\n");
			} else if (cp == '\r') {
				out.append("\\r");
			} else if (cp < 0x20 || cp == 0x7f) {
				out.append(String.format("\\x%02x", cp));
			} else if (!isPrintable(cp)) {
				if (cp <= 0xff) {
					out.append(String.format("\\x%02x", cp));
				} else if (cp <= 0xffff) {
					out.append(String.format("\\u%04x", cp));
				} else {
					out.append(String.format("\\U%08x", cp));
				}
			} else {
				out.appendCodePoint(cp);
			}
		}
		return out.toString();
	}

	/**
	 * A complete literal for value, in the preferred quote unless the value contains it and not the other one.
	 */
	public static String quote(String value, char preferred) {
		char other = preferred == '\'' ? '"' : '\'';
		char q = value.indexOf(preferred) != -1 && value.indexOf(other) == -1 ? other : preferred;
		return q + escape(value, q) + q;
	}

	// str.isprintable(): everything but "Other" and "Separator" categories, with the ASCII space allowed
	static boolean isPrintable(int cp) {
		if (cp == ' ') {
			return true;
		}
		switch (Character.getType(cp)) {
			case Character.CONTROL:
			case Character.FORMAT:
			case Character.SURROGATE:
			case Character.PRIVATE_USE:
			case Character.UNASSIGNED:
			case Character.LINE_SEPARATOR:
			case Character.PARAGRAPH_SEPARATOR:
			case Character.SPACE_SEPARATOR:
				return false;
			default:
				return true;
		}
	}

	/**
	 * @return the letters before the opening quote of a string token, lower-cased
	 */
	public static String prefix(String token) {
		int i = 0;
		while (i < token.length() && Character.isLetter(token.charAt(i))) {
			i++;
		}
		return token.substring(0, i).toLowerCase();
	}

	/**
	 * Decodes a complete string token (prefix, quotes and escapes) into its value.
	 */
	public static String decode(String token) {
		String prefix = prefix(token);
		int start = prefix.length();
		char quote = token.charAt(start);
		int quoteLength = token.startsWith("" + quote + quote + quote, start) && token.length() - start >= 6 ? 3 : 1;
		String body = token.substring(start + quoteLength, token.length() - quoteLength);
		if (prefix.contains("r")) {
			return body;
		}
		return unescape(body);
	}

	static String unescape(String body) {
		StringBuilder out = new StringBuilder(body.length());
		int i = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c != '\\' || i + 1 >= body.length()) {
				out.append(c);
				i++;
				continue;
			}
			char e = body.charAt(i + 1);
			i += 2;
			switch (e) {
				case '\n':
					break;
				case '\\':
				case '\'':
				case '"':
					out.append(e);
					break;
				case 'a':
					out.append('\u0007');
					break;
				case 'b':
					out.append('\b');
					break;
				case 'f':
					out.append('\f');
					break;
				case 'n':
					out.append('\n');
					break;
				case 'r':
					out.append('\r');
					break;
				case 't':
					out.append('\t');
					break;
				case 'v':
					out.append('\u000b');
					break;
				case 'x':
					i = appendHex(out, body, i, 2);
					break;
				case 'u':
					i = appendHex(out, body, i, 4);
					break;
				case 'U':
					i = appendHex(out, body, i, 8);
					break;
				case 'N': {
					int close = body.indexOf('}', i);
					if (i < body.length() && body.charAt(i) == '{' && close != -1) {
						out.appendCodePoint(Character.codePointOf(body.substring(i + 1, close)));
						i = close + 1;
					} else {
						out.append("\\N");
					}
					break;
				}
				default:
					if (e >= '0' && e <= '7') {
						int end = i - 1;
						while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
							end++;
						}
						out.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
						i = end;
					} else {
						// unknown escapes keep their backslash
						out.append('\\').append(e);
					}
			}
		}
		return out.toString();
	}

	private static int appendHex(StringBuilder out, String body, int from, int digits) {
		int end = from + digits;
		if (end > body.length()) {
			throw new IllegalArgumentException("truncated \\x, \\u or \\U escape in string literal");
		}
		out.appendCodePoint(Integer.parseInt(body.substring(from, end), 16));
		return end;
	}

}
