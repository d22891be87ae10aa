package pymig.model.python;

import pymig.util.SourceLocatable;
import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * Source text that is not part of the syntax tree but has to survive printing: comments, the semicolons
 * separating simple statements on one line, backslash line joins, and parentheses that only group an
 * expression.
 */
public class PyTrivia extends SourceLocatable {

	public enum Kind {
		COMMENT,
		SEMICOLON,
		LINE_JOIN,
		GROUP_OPEN,
		GROUP_CLOSE,
	}

	private final Kind kind;
	private final String text;
	private final SourceLocation location;

	public PyTrivia(SourceLocation location, Kind kind, String text) {
		this.location = location;
		this.kind = kind;
		this.text = text;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyTrivia pyTrivia = (PyTrivia) o;
		return kind == pyTrivia.kind &&
				Objects.equals(text, pyTrivia.text) &&
				Objects.equals(location, pyTrivia.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, location);
	}

	@Override
	public String toString() {
		return "PyTrivia [kind=" + kind + ", text=" + text + ", location=" + location.shortString() + "]";
	}
}
