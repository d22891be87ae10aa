package pymig.errors;

import pymig.Unreachable;
import pymig.formatters.IssueFormattingVisitor;
import pymig.trans.PyMigTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends PyMigTransException {
	public Issue() {
		super("");
	}
	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(sw));
		} catch (IOException e) {
			throw new Unreachable("writing to a string", e);
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
