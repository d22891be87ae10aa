package pymig.formatters;

import pymig.model.python.PyTrivia;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A writer that knows where it is: it tracks the output line and column, and can pad its way to a position
 * recorded in the original source before writing a token there. Walking a tree and placing every token at its
 * recorded position reproduces the original layout.
 *
 * Comments, statement semicolons, line joins and grouping parentheses are not part of the tree; they are kept
 * as trivia and written out, in source order, whenever a later position is reached.
 *
 * Text can be redirected into a {@link Capture}. Inside a capture no trivia is written and positions are only
 * used relative to each other, so a captured render comes out on a single line.
 */
public class LayoutWriter extends Writer {

	private final Writer out;
	private final List<String> sourceLines;
	private final List<PyTrivia> trivia;
	private int nextTrivia = 0;

	private int line = 1;
	private int column = 0;
	private char lastChar = '\n';
	private int firstLine = Integer.MIN_VALUE;
	private int lastLine = Integer.MAX_VALUE;

	// a comment or a line join ends the current output line
	private boolean lineClosed = false;

	// a line join was written and nothing has followed it yet
	private boolean continued = false;

	// which source line the current output line shows, and how far it is shifted to the right
	private int lineSource = 1;
	private int lineDelta = 0;

	// targets on this source line are moved next to the text of a rewritten node
	private int anchorSourceLine = -1;
	private int anchorSourceColumn;
	private int anchorLine;
	private int anchorColumn;

	private final Deque<Capture> captures = new ArrayDeque<>();

	public static class Capture implements AutoCloseable {

		private final LayoutWriter writer;
		private final StringBuilder buffer = new StringBuilder();
		private final int savedLine;
		private final int savedColumn;
		private final char savedLastChar;
		private final boolean savedLineClosed;

		// the source position just after the last placed text
		private int shadowLine = -1;
		private int shadowColumn = -1;

		Capture(LayoutWriter writer) {
			this.writer = writer;
			this.savedLine = writer.line;
			this.savedColumn = writer.column;
			this.savedLastChar = writer.lastChar;
			this.savedLineClosed = writer.lineClosed;
			// captured text starts out on a line of its own
			writer.lastChar = '\n';
			writer.lineClosed = false;
		}

		public String getText() {
			return buffer.toString();
		}

		String padding(int sourceLine, int sourceColumn, String text) {
			if (shadowLine < 0 || buffer.length() == 0) {
				return "";
			}
			if (sourceLine == shadowLine) {
				return sourceColumn > shadowColumn ? spaces(sourceColumn - shadowColumn) : "";
			}
			if (sourceLine < shadowLine) {
				return "";
			}
			char last = buffer.charAt(buffer.length() - 1);
			if ("([{ ".indexOf(last) != -1 || text.startsWith(")") || text.startsWith("]")
					|| text.startsWith("}") || text.startsWith(",")) {
				return "";
			}
			return " ";
		}

		void moveShadow(int sourceLine, int sourceColumn, String text) {
			int newline = text.lastIndexOf('\n');
			if (newline == -1) {
				shadowLine = sourceLine;
				shadowColumn = sourceColumn + text.length();
			} else {
				int count = 0;
				for (int i = 0; i < text.length(); i++) {
					if (text.charAt(i) == '\n') {
						count++;
					}
				}
				shadowLine = sourceLine + count;
				shadowColumn = text.length() - newline - 1;
			}
		}

		@Override
		public void close() {
			writer.endCapture(this);
		}

	}

	public LayoutWriter(Writer out) {
		this(out, Collections.emptyList(), Collections.emptyList());
	}

	public LayoutWriter(Writer out, List<String> sourceLines, List<PyTrivia> trivia) {
		this.out = out;
		this.sourceLines = sourceLines;
		this.trivia = trivia;
	}

	/**
	 * Only output lines in [first, last] reach the underlying writer. Everything else is still counted.
	 */
	public void setWindow(int first, int last) {
		this.firstLine = first;
		this.lastLine = last;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @return whether the last character written belongs to a word, so that an opening parenthesis written next
	 * would read as a call
	 */
	public boolean isAfterWord() {
		return isWordChar(lastChar);
	}

	public boolean isCapturing() {
		return !captures.isEmpty();
	}

	public Capture capture() {
		Capture capture = new Capture(this);
		captures.push(capture);
		return capture;
	}

	private void endCapture(Capture capture) {
		if (captures.peek() != capture) {
			throw new IllegalStateException("captures must be closed in the reverse order they were opened");
		}
		captures.pop();
		line = capture.savedLine;
		column = capture.savedColumn;
		lastChar = capture.savedLastChar;
		lineClosed = capture.savedLineClosed;
	}

	static String spaces(int count) {
		StringBuilder b = new StringBuilder(count);
		for (int i = 0; i < count; i++) {
			b.append(' ');
		}
		return b.toString();
	}

	private static boolean isBlank(char c) {
		return c == ' ' || c == '\t' || c == '\f';
	}

	private static boolean isBlank(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (!isBlank(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private String sourceLine(int number) {
		if (number < 1 || number > sourceLines.size()) {
			return null;
		}
		return sourceLines.get(number - 1);
	}

	// raw output

	private void output(String chunk) throws IOException {
		Capture capture = captures.peek();
		if (capture != null) {
			capture.buffer.append(chunk);
		} else if (firstLine <= line && line <= lastLine) {
			out.write(chunk);
		}
	}

	private void newline() throws IOException {
		if (!isCapturing()) {
			String src = sourceLine(lineSource);
			int from = column - lineDelta;
			if (src != null && from >= 0 && from < src.length() && isBlank(src.substring(from))) {
				output(src.substring(from));
			}
			if (continued && column == 0) {
				// a blank line left behind by a collapsed node, in the middle of a joined line
				output("\\");
			}
		}
		output("\n");
		line++;
		column = 0;
		lastChar = '\n';
		lineClosed = false;
		lineSource = line;
		lineDelta = 0;
	}

	/**
	 * Writes text as it is, with no padding.
	 */
	public void emit(String text) throws IOException {
		if (text.isEmpty()) {
			return;
		}
		if (lineClosed && text.charAt(0) != '\n') {
			newline();
		}
		int start = 0;
		while (start < text.length()) {
			int newline = text.indexOf('\n', start);
			if (newline == -1) {
				String chunk = text.substring(start);
				output(chunk);
				column += chunk.length();
				lastChar = chunk.charAt(chunk.length() - 1);
				if (!isCapturing()) {
					continued = false;
				}
				break;
			}
			output(text.substring(start, newline + 1));
			line++;
			column = 0;
			lastChar = '\n';
			lineClosed = false;
			lineSource = line;
			lineDelta = 0;
			start = newline + 1;
		}
		Capture capture = captures.peek();
		if (capture != null && capture.shadowLine >= 0 && text.indexOf('\n') == -1) {
			capture.shadowColumn += text.length();
		}
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		emit(String.valueOf(chars, offset, len));
	}

	// placement

	/**
	 * Pads to the recorded source position, then writes text there. Pending trivia that comes earlier in the
	 * source is written first.
	 */
	public void place(String text, int sourceLine, int sourceColumn) throws IOException {
		if (sourceLine < 0) {
			emit(separated("", text));
			return;
		}
		Capture capture = captures.peek();
		if (capture != null) {
			String pad = capture.padding(sourceLine, sourceColumn, text);
			emit(separated(pad, text));
			capture.moveShadow(sourceLine, sourceColumn, text);
			return;
		}
		flushTrivia(sourceLine, sourceColumn);
		moveTo(sourceLine, sourceColumn);
		emit(separated("", text));
	}

	public void place(String text, SourceLocation location) throws IOException {
		if (location == null || location.isUnknown()) {
			emit(separated("", text));
			return;
		}
		place(text, location.getStartLine(), location.getStartColumn());
	}

	/**
	 * Places a slice of the source as it is. Trivia inside the slice is part of the text and is dropped.
	 */
	public void placeVerbatim(String text, SourceLocation location) throws IOException {
		if (location == null || location.isUnknown()) {
			emit(separated("", text));
			return;
		}
		Capture capture = captures.peek();
		if (capture != null) {
			emit(separated(capture.padding(location.getStartLine(), location.getStartColumn(), text), text));
			capture.shadowLine = location.getEndLine();
			capture.shadowColumn = location.getEndColumn();
			return;
		}
		place(text, location);
		discardTrivia(location);
	}

	// two words must not run into each other when the cursor is already past a target
	private String separated(String pad, String text) {
		if (pad.isEmpty() && !text.isEmpty() && isWordChar(lastChar) && isWordChar(text.charAt(0))) {
			return " " + text;
		}
		return pad + text;
	}

	/**
	 * Writes a token that the source has next, at the column the source has it, or right here when the source
	 * does not continue with it.
	 */
	public void token(String text) throws IOException {
		token(text, text);
	}

	/**
	 * Like {@link #token(String)}, writing fallback instead when the source does not continue with text.
	 */
	public void token(String text, String fallback) throws IOException {
		if (!findAndPlace(text)) {
			emit(fallback);
		}
	}

	/**
	 * Like {@link #token(String)}, for a keyword that needs a space before it when it cannot be found.
	 */
	public void keyword(String word) throws IOException {
		if (!findAndPlace(word)) {
			emit(" " + word);
		}
	}

	private boolean findAndPlace(String text) throws IOException {
		Capture capture = captures.peek();
		int l;
		int c;
		if (capture != null) {
			// only look right after the last placed text; trivia stays pending in a capture
			if (capture.shadowLine < 0) {
				return false;
			}
			l = capture.shadowLine;
			c = capture.shadowColumn;
		} else {
			l = lineSource;
			c = column - lineDelta;
		}
		while (true) {
			String src = sourceLine(l);
			if (src == null || c < 0) {
				return false;
			}
			if (c >= src.length()) {
				l++;
				c = 0;
				continue;
			}
			if (isBlank(src.charAt(c))) {
				c++;
				continue;
			}
			if (capture == null && nextTrivia < trivia.size()) {
				PyTrivia t = trivia.get(nextTrivia);
				SourceLocation loc = t.getLocation();
				if (loc.getStartLine() == l && loc.getStartColumn() == c) {
					if (t.getKind() == PyTrivia.Kind.SEMICOLON) {
						return false;
					}
					nextTrivia++;
					writeTrivia(t);
					c = t.getKind() == PyTrivia.Kind.COMMENT ? src.length() : c + t.getText().length();
					continue;
				}
			}
			int end = c + text.length();
			if (src.startsWith(text, c)
					&& (end >= src.length() || !isWordChar(text.charAt(text.length() - 1)) || !isWordChar(src.charAt(end)))) {
				place(text, l, c);
				return true;
			}
			return false;
		}
	}

	/**
	 * @return whether the cursor ended up exactly at the target
	 */
	private boolean moveTo(int sourceLine, int sourceColumn) throws IOException {
		int targetLine = sourceLine;
		int targetColumn = sourceColumn;
		if (anchorSourceLine >= 0) {
			if (sourceLine == anchorSourceLine) {
				targetLine = anchorLine;
				targetColumn = anchorColumn + (sourceColumn - anchorSourceColumn);
			} else if (sourceLine > anchorSourceLine) {
				anchorSourceLine = -1;
			}
		}
		while (line < targetLine) {
			newline();
		}
		if (line == targetLine && column < targetColumn) {
			emit(padding(column, targetColumn));
		}
		return line == targetLine && column == targetColumn;
	}

	// copies the source's own whitespace where the gap is whitespace in the source
	private String padding(int fromColumn, int toColumn) {
		String src = sourceLine(lineSource);
		int from = fromColumn - lineDelta;
		int to = toColumn - lineDelta;
		if (src != null && from >= 0 && to <= src.length()) {
			String gap = src.substring(from, to);
			if (isBlank(gap)) {
				return gap;
			}
		}
		return spaces(toColumn - fromColumn);
	}

	/**
	 * @return whether the output position of the source position lies ahead of the cursor with source text in
	 * between that is neither whitespace nor trivia, that is whether the text that used to precede it is gone
	 */
	public boolean isDetached(int sourceLine, int sourceColumn) {
		if (sourceLine < 0) {
			return false;
		}
		int targetLine = sourceLine;
		int targetColumn = sourceColumn;
		if (anchorSourceLine >= 0 && sourceLine == anchorSourceLine) {
			targetLine = anchorLine;
			targetColumn = anchorColumn + (sourceColumn - anchorSourceColumn);
		}
		if (targetLine < line || (targetLine == line && targetColumn <= column)) {
			return false;
		}
		if (isCapturing() || sourceLines.isEmpty()) {
			return true;
		}
		int l = lineSource;
		int c = column - lineDelta;
		while (l < sourceLine || (l == sourceLine && c < sourceColumn)) {
			String src = sourceLine(l);
			if (src == null || c < 0) {
				return true;
			}
			if (c >= src.length()) {
				l++;
				c = 0;
				continue;
			}
			char ch = src.charAt(c);
			if (ch == '#') {
				c = src.length();
				continue;
			}
			if (!isBlank(ch) && "\\();".indexOf(ch) == -1) {
				return true;
			}
			c++;
		}
		return false;
	}

	/**
	 * Makes the rest of the source line that ends at (sourceLine, sourceColumn) follow the current cursor,
	 * keeping its relative spacing. Used after text that replaces a node has been written.
	 */
	public void setAnchor(int sourceLine, int sourceColumn) {
		Capture capture = captures.peek();
		if (capture != null) {
			capture.shadowLine = sourceLine;
			capture.shadowColumn = sourceColumn;
			return;
		}
		anchorSourceLine = sourceLine;
		anchorSourceColumn = sourceColumn;
		anchorLine = line;
		anchorColumn = column;
		lineSource = sourceLine;
		lineDelta = column - sourceColumn;
	}

	/**
	 * @return the source text covered by location, or null when the source is not available
	 */
	public String sourceSlice(SourceLocation location) {
		if (location == null || location.isUnknown()) {
			return null;
		}
		String first = sourceLine(location.getStartLine());
		String last = sourceLine(location.getEndLine());
		if (first == null || last == null || location.getStartColumn() > first.length()
				|| location.getEndColumn() > last.length()) {
			return null;
		}
		if (location.getStartLine() == location.getEndLine()) {
			if (location.getEndColumn() < location.getStartColumn()) {
				return null;
			}
			return first.substring(location.getStartColumn(), location.getEndColumn());
		}
		StringBuilder slice = new StringBuilder(first.substring(location.getStartColumn()));
		for (int l = location.getStartLine() + 1; l < location.getEndLine(); l++) {
			slice.append('\n').append(sourceLine(l));
		}
		slice.append('\n').append(last, 0, location.getEndColumn());
		return slice.toString();
	}

	// trivia

	private boolean before(SourceLocation location, int sourceLine, int sourceColumn) {
		return location.getStartLine() < sourceLine
				|| (location.getStartLine() == sourceLine && location.getStartColumn() < sourceColumn);
	}

	private boolean within(SourceLocation location, SourceLocation span) {
		return !before(location, span.getStartLine(), span.getStartColumn())
				&& before(location, span.getEndLine(), span.getEndColumn());
	}

	private void flushTrivia(int sourceLine, int sourceColumn) throws IOException {
		while (nextTrivia < trivia.size() && before(trivia.get(nextTrivia).getLocation(), sourceLine, sourceColumn)) {
			writeTrivia(trivia.get(nextTrivia++));
		}
	}

	private void writeTrivia(PyTrivia t) throws IOException {
		SourceLocation loc = t.getLocation();
		switch (t.getKind()) {
			case COMMENT:
				if (!moveTo(loc.getStartLine(), loc.getStartColumn()) && column > 0 && !isBlank(lastChar)) {
					emit(" ");
				}
				emit(t.getText());
				lineClosed = true;
				break;
			case LINE_JOIN:
				moveTo(loc.getStartLine(), loc.getStartColumn());
				emit(t.getText());
				lineClosed = true;
				continued = !isCapturing();
				break;
			case SEMICOLON:
			case GROUP_OPEN:
			case GROUP_CLOSE:
				moveTo(loc.getStartLine(), loc.getStartColumn());
				emit(t.getText());
				break;
		}
	}

	/**
	 * Drops pending trivia inside span, whose text has been replaced.
	 */
	public void discardTrivia(SourceLocation span) {
		if (isCapturing() || span == null || span.isUnknown()) {
			return;
		}
		while (nextTrivia < trivia.size() && within(trivia.get(nextTrivia).getLocation(), span)) {
			nextTrivia++;
		}
	}

	public boolean hasCommentsWithin(SourceLocation span) {
		if (span == null || span.isUnknown()) {
			return false;
		}
		for (int i = nextTrivia; i < trivia.size(); i++) {
			PyTrivia t = trivia.get(i);
			if (t.getKind() == PyTrivia.Kind.COMMENT && within(t.getLocation(), span)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Writes the trivia left after the last node, pads to the number of lines of the source, and ends the output
	 * with a newline when the cursor is not at the start of a line.
	 */
	public void finish() throws IOException {
		if (isCapturing()) {
			throw new IllegalStateException("cannot finish while a capture is open");
		}
		flushTrivia(Integer.MAX_VALUE, Integer.MAX_VALUE);
		while (line < sourceLines.size()) {
			newline();
		}
		if (column != 0) {
			newline();
		}
		out.flush();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
