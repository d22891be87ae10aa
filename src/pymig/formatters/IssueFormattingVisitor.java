package pymig.formatters;

import pymig.errors.IssueVisitor;
import pymig.model.python.PyNode;
import pymig.trans.IOErrorIssue;
import pymig.trans.passes.migrate.RenderIssue;
import pymig.trans.passes.parse.ParsingIssue;
import pymig.trans.passes.parse.option.OptionParserIssue;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.io.Writer;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final Writer out;

	public IssueFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing " + parsingIssue.getLanguage() + ": ");
		out.write(parsingIssue.getError().getMessage());
		SourceLocation location = parsingIssue.getLocation();
		if (!location.isUnknown()) {
			out.write("\n");
			out.write(location.prettyString(parsingIssue.getSourceLines()));
		}
		return null;
	}

	@Override
	public Void visit(RenderIssue renderIssue) throws IOException {
		RenderException error = renderIssue.getError();
		out.write("unable to render Python code: ");
		out.write(error.getMsg());
		// innermost first
		for (PyNode node : error.getNodes()) {
			out.write("\nAt node ");
			out.write(node.describe());
			out.write("\n");
			out.write(node.getLocation().prettyString(renderIssue.getSourceLines()));
		}
		return null;
	}

}
