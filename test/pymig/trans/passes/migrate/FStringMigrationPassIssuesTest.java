package pymig.trans.passes.migrate;

import org.junit.Test;
import pymig.errors.TopLevelIssueContext;
import pymig.model.python.PyModule;
import pymig.model.python.PySourceFile;
import pymig.trans.passes.parse.ParsingIssue;
import pymig.trans.passes.parse.PythonParsingPass;

import java.io.StringWriter;
import java.nio.file.Paths;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static pymig.model.python.PyBuilder.*;

public class FStringMigrationPassIssuesTest {

	private static String migrate(String source, int first, int last) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PySourceFile file = PythonParsingPass.perform(Paths.get("test.py"), source);
		StringWriter out = new StringWriter();
		FStringMigrationPass.perform(ctx, file, out, first, last);
		assertFalse(ctx.format(), ctx.hasErrors());
		return out.toString();
	}

	@Test
	public void testWindowSelectsOutputLines() {
		String source = "a = 1\nb = '%s' % (x,)\nc = 3\n";
		assertThat(migrate(source, 2, 2), is("b = f'{x}'\n"));
		assertThat(migrate(source, 2, 3), is("b = f'{x}'\nc = 3\n"));
		assertThat(migrate(source, 5, 9), is(""));
	}

	// line numbers keep referring to the source after a multi-line expression collapses
	@Test
	public void testWindowAfterCollapsedExpression() {
		String source = "a = '%s' % (x,\n           y)\nb = 2\n";
		// the format string has a single directive and two arguments, so nothing is rewritten
		assertThat(migrate(source, 3, 3), is("b = 2\n"));
		String rewritten = "a = '%s %s' % (x,\n              y)\nb = 2\n";
		assertThat(migrate(rewritten, 1, 1), is("a = f'{x} {y}'\n"));
		assertThat(migrate(rewritten, 2, 3), is("\nb = 2\n"));
	}

	@Test
	public void testMissingChildIsReportedWithNodeBacktrace() {
		PyModule module = module(
				expr(list(name("a"), null))
		);
		PySourceFile file = new PySourceFile(Paths.get("built.py"), "", module, Collections.emptyList(),
				Collections.emptySet());
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		FStringMigrationPass.perform(ctx, file, new StringWriter());
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(RenderIssue.class));
		String message = ctx.getIssues().get(0).getMessage();
		assertThat(message, containsString("unable to render Python code: missing child node"));
		assertThat(message, containsString("\nAt node PyList <unknown>"));
		assertThat(message, containsString("\nAt node PyModule <unknown>"));
	}

	@Test
	public void testParseErrorPointsAtSource() {
		try {
			PythonParsingPass.perform(Paths.get("test.py"), "x = 1\ny = = 2\n");
			fail("expected a parsing issue");
		} catch (ParsingIssue issue) {
			assertThat(issue.getMessage(), containsString("error parsing Python: "));
			assertThat(issue.getMessage(), containsString("y = = 2\n    ^"));
		}
	}

	@Test
	public void testUnclosedBracketIsAParsingIssue() {
		try {
			PythonParsingPass.perform(Paths.get("test.py"), "x = (1,\n");
			fail("expected a parsing issue");
		} catch (ParsingIssue issue) {
			assertThat(issue.getMessage(), containsString("unexpected EOF inside brackets"));
		}
	}

}
