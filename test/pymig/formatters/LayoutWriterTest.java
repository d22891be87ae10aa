package pymig.formatters;

import org.junit.Test;
import pymig.model.python.PyTrivia;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LayoutWriterTest {

	@Test
	public void testPlacePadsToPosition() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw);
		out.place("a", 1, 0);
		out.place("b", 1, 4);
		out.place("c", 3, 2);
		out.finish();
		assertThat(sw.toString(), is("a   b\n\n  c\n"));
	}

	@Test
	public void testWordsNeverRunTogether() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw);
		out.place("abc", 1, 0);
		out.place("d", 1, 1);
		out.place("(", 1, 2);
		out.finish();
		assertThat(sw.toString(), is("abc d(\n"));
	}

	@Test
	public void testCaptureIsRelativeAndSingleLine() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw);
		out.place("x", 1, 0);
		try (LayoutWriter.Capture capture = out.capture()) {
			assertTrue(out.isCapturing());
			out.place("a", 4, 10);
			out.place("+", 4, 12);
			out.place("b", 5, 2);
			assertThat(capture.getText(), is("a + b"));
		}
		assertFalse(out.isCapturing());
		assertThat(out.getLine(), is(1));
		assertThat(out.getColumn(), is(1));
		out.finish();
		assertThat(sw.toString(), is("x\n"));
	}

	@Test(expected = IllegalStateException.class)
	public void testFinishInsideCapture() throws IOException {
		LayoutWriter out = new LayoutWriter(new StringWriter());
		out.capture();
		out.finish();
	}

	@Test
	public void testCommentsAreWrittenWhenPassed() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw, Arrays.asList("x = 1  # c", "y = 2", ""),
				Collections.singletonList(new PyTrivia(SourceLocation.at(1, 7, 3), PyTrivia.Kind.COMMENT, "# c")));
		out.place("x", 1, 0);
		out.place("=", 1, 2);
		out.place("1", 1, 4);
		out.place("y", 2, 0);
		out.place("=", 2, 2);
		out.place("2", 2, 4);
		out.finish();
		assertThat(sw.toString(), is("x = 1  # c\ny = 2\n"));
	}

	@Test
	public void testSourceWhitespaceIsCopied() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw, Arrays.asList("\tx =\t1  ", ""), Collections.emptyList());
		out.place("x", 1, 1);
		out.place("=", 1, 3);
		out.place("1", 1, 5);
		out.finish();
		assertThat(sw.toString(), is("\tx =\t1  \n"));
	}

	@Test
	public void testWindow() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw);
		out.setWindow(2, 2);
		out.place("a", 1, 0);
		out.place("b", 2, 0);
		out.place("c", 3, 0);
		out.finish();
		assertThat(sw.toString(), is("b\n"));
	}

	@Test
	public void testAnchorFollowsReplacement() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw, Arrays.asList("foo(bar, baz)", ""), Collections.emptyList());
		out.place("foo", 1, 0);
		out.place("(", 1, 3);
		// "bar" is replaced by something longer
		out.place("quux", 1, 4);
		out.setAnchor(1, 7);
		out.token(",");
		out.place("baz", 1, 9);
		out.place(")", 1, 12);
		out.finish();
		assertThat(sw.toString(), is("foo(quux, baz)\n"));
	}

	@Test
	public void testBlankLinesInsideJoinedLineAreContinued() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw, Arrays.asList("x = (a,", "  b) + \\", "    c", ""),
				Collections.singletonList(new PyTrivia(SourceLocation.at(2, 7, 1), PyTrivia.Kind.LINE_JOIN, "\\")));
		out.place("x", 1, 0);
		out.place("=", 1, 2);
		// "(a,\n  b)" is replaced by a single line
		out.place("y", 1, 4);
		out.setAnchor(2, 4);
		out.place("+", 2, 5);
		out.place("c", 3, 4);
		out.finish();
		assertThat(sw.toString(), is("x = y + \\\n\\\n    c\n"));
	}

	@Test
	public void testTokenFindsSourceColumn() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw, Arrays.asList("f(a , b)", ""), Collections.emptyList());
		out.place("f", 1, 0);
		out.place("(", 1, 1);
		out.place("a", 1, 2);
		out.token(",", ", ");
		out.place("b", 1, 6);
		out.token(")");
		out.finish();
		assertThat(sw.toString(), is("f(a , b)\n"));
	}

	@Test
	public void testTokenFallback() throws IOException {
		StringWriter sw = new StringWriter();
		LayoutWriter out = new LayoutWriter(sw);
		out.emit("x");
		out.token(",", ", ");
		out.emit("y");
		out.keyword("as");
		out.emit(" z");
		out.finish();
		assertThat(sw.toString(), is("x, y as z\n"));
	}

	@Test
	public void testSourceSlice() {
		LayoutWriter out = new LayoutWriter(new StringWriter(), Arrays.asList("abc def", "ghi", ""),
				Collections.emptyList());
		assertThat(out.sourceSlice(SourceLocation.at(1, 4, 3)), is("def"));
		assertThat(out.sourceSlice(new SourceLocation(null, -1, -1, 1, 2, 4, 2)), is("def\ngh"));
		assertThat(out.sourceSlice(SourceLocation.unknown()), nullValue());
		assertThat(out.sourceSlice(SourceLocation.at(7, 0, 1)), nullValue());
	}

	@Test
	public void testDetached() throws IOException {
		LayoutWriter out = new LayoutWriter(new StringWriter(), Arrays.asList("x = (  # c", "    a)", ""),
				Collections.emptyList());
		out.place("x", 1, 0);
		// the "=" has not been written yet
		assertTrue(out.isDetached(2, 4));
		out.place("=", 1, 2);
		// only whitespace, a bracket and a comment lie between the cursor and "a"
		assertFalse(out.isDetached(2, 4));
		// the cursor is already past it
		assertFalse(out.isDetached(1, 0));
		out.place("y", 1, 4);
		assertFalse(out.isDetached(1, 4));
	}

}
