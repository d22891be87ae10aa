package pymig.trans.passes.migrate;

import pymig.errors.Issue;
import pymig.errors.IssueVisitor;
import pymig.formatters.RenderException;

import java.util.List;

/**
 * A tree that could not be rendered, with the source it came from for the backtrace.
 */
public class RenderIssue extends Issue {
	private final RenderException error;
	private final List<String> sourceLines;

	public RenderIssue(RenderException error, List<String> sourceLines) {
		initCause(error);
		this.error = error;
		this.sourceLines = sourceLines;
	}

	public RenderException getError() {
		return error;
	}

	public List<String> getSourceLines() {
		return sourceLines;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
