package pymig.trans.passes.parse;

import pymig.PyMigException;
import pymig.errors.Issue;
import pymig.errors.IssueVisitor;
import pymig.util.SourceLocation;

import java.util.List;

public class ParsingIssue extends Issue {
	private final String language;
	private final PyMigException error;
	private final List<String> sourceLines;

	public ParsingIssue(String language, PyMigException error, List<String> sourceLines) {
		initCause(error);
		this.language = language;
		this.error = error;
		this.sourceLines = sourceLines;
	}

	public PyMigException getError() {
		return error;
	}

	public String getLanguage() { return language; }

	public SourceLocation getLocation() {
		return error.getLocation();
	}

	public List<String> getSourceLines() {
		return sourceLines;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
