package pymig.trans.passes.parse.option;

import pymig.errors.Issue;
import pymig.errors.IssueVisitor;

public class OptionParserIssue extends Issue {

	public OptionParserIssue(String message) {
		super(message);
	}

	public String getDetail() {
		return super.getMsg();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
