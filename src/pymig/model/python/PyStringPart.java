package pymig.model.python;

import pymig.util.SourceLocatable;
import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * One string token of a possibly implicitly concatenated string literal, in its exact source spelling.
 */
public class PyStringPart extends SourceLocatable {
	private final SourceLocation location;
	private final String text;

	public PyStringPart(SourceLocation location, String text) {
		this.location = location;
		this.text = text;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyStringPart that = (PyStringPart) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}

	@Override
	public String toString() {
		return text;
	}
}
