package pymig.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A span of Python source text. Lines are 1-based, columns are 0-based and count characters.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	/**
	 * A location with no backing file, used for nodes that are built by hand but still need a position.
	 */
	public static SourceLocation at(int line, int column, int length) {
		return new SourceLocation(null, -1, -1, line, line, column, column + length);
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	public boolean hasOffsets() {
		return startOffset >= 0 && endOffset >= startOffset;
	}

	/**
	 * Writes "line:column", or the range form when the location spans more than one line.
	 */
	public String shortString() {
		if (isUnknown()) {
			return "<unknown>";
		}
		if (startLine != endLine) {
			return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
		}
		return startLine + ":" + startColumn;
	}

	/**
	 * The first source line of this location followed by a caret under its start column.
	 */
	public String prettyString(List<String> sourceLines) {
		if (isUnknown() || sourceLines == null || startLine > sourceLines.size()) {
			return "at unknown source location";
		}
		String line = sourceLines.get(startLine - 1);
		StringBuilder caret = new StringBuilder();
		for (int i = 0; i < startColumn && i < line.length(); i++) {
			caret.append(line.charAt(i) == '\t' ? '\t' : ' ');
		}
		caret.append('^');
		return line + "\n" + caret;
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (!Objects.equals(file, other.getFile())) {
			throw new RuntimeException("Tried to combine source locations from two different files: " + file + ", " + other.getFile());
		}
		SourceLocation first = compareTo(other) <= 0 ? this : other;
		SourceLocation last;
		if (endLine != other.endLine) {
			last = endLine > other.endLine ? this : other;
		} else {
			last = endColumn >= other.endColumn ? this : other;
		}
		return new SourceLocation(file,
				first.startOffset, last.endOffset,
				first.startLine, last.endLine,
				first.startColumn, last.endColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SourceLocation other = (SourceLocation) o;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStartLine = Integer.compare(getStartLine(), o.getStartLine());
		if (comparedStartLine != 0) {
			return comparedStartLine;
		}
		int comparedStartColumn = Integer.compare(getStartColumn(), o.getStartColumn());
		if (comparedStartColumn != 0) {
			return comparedStartColumn;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
