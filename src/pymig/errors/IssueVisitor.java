package pymig.errors;

import pymig.trans.IOErrorIssue;
import pymig.trans.passes.migrate.RenderIssue;
import pymig.trans.passes.parse.ParsingIssue;
import pymig.trans.passes.parse.option.OptionParserIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(RenderIssue renderIssue) throws E;
}
