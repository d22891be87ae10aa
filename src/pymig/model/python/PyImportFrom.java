package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * from module import names
 *
 * The module name keeps its leading dots.
 */
public class PyImportFrom extends PyStatement {

	private final String module;
	private final SourceLocation moduleLocation;
	private final SourceLocation importLocation;
	private final List<PyAlias> names;
	private final boolean parenthesized;
	private final SourceLocation closeLocation;
	private final boolean trailingComma;

	public PyImportFrom(SourceLocation location, String module, SourceLocation moduleLocation, SourceLocation importLocation, List<PyAlias> names, boolean parenthesized, SourceLocation closeLocation, boolean trailingComma) {
		super(location);
		this.module = module;
		this.moduleLocation = moduleLocation;
		this.importLocation = importLocation;
		this.names = names;
		this.parenthesized = parenthesized;
		this.closeLocation = closeLocation;
		this.trailingComma = trailingComma;
	}

	public String getModule() {
		return module;
	}

	public SourceLocation getModuleLocation() {
		return moduleLocation;
	}

	public SourceLocation getImportLocation() {
		return importLocation;
	}

	public List<PyAlias> getNames() {
		return names;
	}

	public boolean isParenthesized() {
		return parenthesized;
	}

	public SourceLocation getCloseLocation() {
		return closeLocation;
	}

	public boolean isTrailingComma() {
		return trailingComma;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyImportFrom that = (PyImportFrom) o;
		return Objects.equals(module, that.module) &&
				Objects.equals(names, that.names) &&
				parenthesized == that.parenthesized &&
				trailingComma == that.trailingComma;
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, names, parenthesized, trailingComma);
	}
}
