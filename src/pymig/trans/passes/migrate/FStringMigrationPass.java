package pymig.trans.passes.migrate;

import pymig.errors.IssueContext;
import pymig.formatters.LayoutWriter;
import pymig.formatters.PyNodeFormattingVisitor;
import pymig.formatters.RenderException;
import pymig.formatters.RenderState;
import pymig.model.python.PySourceFile;
import pymig.trans.IOErrorIssue;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes a parsed module back out with its layout, turning every format expression that can be rewritten into an
 * f-string. Only output lines in [firstLine, lastLine] are written.
 */
public class FStringMigrationPass {
	private FStringMigrationPass() {}

	public static void perform(IssueContext ctx, PySourceFile source, Writer output, int firstLine, int lastLine) {
		LayoutWriter out = new LayoutWriter(output, source.getLines(), source.getTrivia());
		out.setWindow(firstLine, lastLine);
		PyNodeFormattingVisitor visitor = new PyNodeFormattingVisitor(
				out, new RenderState(source.getGroupedExpressions()));
		try {
			visitor.render(source.getModule());
			out.finish();
		} catch (RenderException e) {
			ctx.error(new RenderIssue(e, source.getLines()));
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		}
	}

	public static void perform(IssueContext ctx, PySourceFile source, Writer output) {
		perform(ctx, source, output, Integer.MIN_VALUE, Integer.MAX_VALUE);
	}
}
