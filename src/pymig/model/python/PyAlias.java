package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyAlias extends PyNode {

	private final String name;
	private final String asName;
	private final SourceLocation asNameLocation;

	public PyAlias(SourceLocation location, String name, String asName, SourceLocation asNameLocation) {
		super(location);
		this.name = name;
		this.asName = asName;
		this.asNameLocation = asNameLocation;
	}

	public String getName() {
		return name;
	}

	public String getAsName() {
		return asName;
	}

	public SourceLocation getAsNameLocation() {
		return asNameLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAlias that = (PyAlias) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(asName, that.asName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, asName);
	}
}
