package pymig.formatters;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FormatDirectiveTest {

	@Test
	public void testScan() {
		List<FormatDirective> directives = FormatDirective.scan("%s and %(k)r, %-5.2f %% %*d");
		assertThat(directives, is(Arrays.asList(
				new FormatDirective(0, 2, null, "", null, null, 's'),
				new FormatDirective(7, 12, "(k)", "", null, null, 'r'),
				new FormatDirective(14, 20, null, "-", "5", "2", 'f'),
				new FormatDirective(21, 23, null, "", null, null, '%'),
				new FormatDirective(24, 27, null, "", "*", null, 'd')
		)));
	}

	@Test
	public void testSubstitution() {
		assertTrue(FormatDirective.scan("%s").get(0).isSubstitution());
		assertTrue(FormatDirective.scan("%r").get(0).isSubstitution());
		assertTrue(FormatDirective.scan("%10s").get(0).isSubstitution());
		assertTrue(FormatDirective.scan("%-.3r").get(0).isSubstitution());
		assertFalse(FormatDirective.scan("%d").get(0).isSubstitution());
		assertFalse(FormatDirective.scan("%*s").get(0).isSubstitution());
		assertFalse(FormatDirective.scan("%.*s").get(0).isSubstitution());
		assertFalse(FormatDirective.scan("%(name)s").get(0).isSubstitution());
		assertFalse(FormatDirective.scan("%%").get(0).isSubstitution());
	}

	@Test
	public void testFormatSpec() {
		assertThat(FormatDirective.scan("%s").get(0).getFormatSpec(), is(""));
		assertThat(FormatDirective.scan("%-s").get(0).getFormatSpec(), is(""));
		assertThat(FormatDirective.scan("%5s").get(0).getFormatSpec(), is(">5"));
		assertThat(FormatDirective.scan("%-5r").get(0).getFormatSpec(), is("<5"));
		assertThat(FormatDirective.scan("%.3s").get(0).getFormatSpec(), is(".3"));
		assertThat(FormatDirective.scan("%0-8.2s").get(0).getFormatSpec(), is("<8.2"));
		// zero padding and signs only apply to numbers
		assertThat(FormatDirective.scan("%+05s").get(0).getFormatSpec(), is(">5"));
	}

	@Test
	public void testLiteralPercent() {
		FormatDirective percent = FormatDirective.scan("100%%").get(0);
		assertTrue(percent.isLiteralPercent());
		assertThat(percent.getStart(), is(3));
		assertThat(percent.getEnd(), is(5));
	}

	@Test
	public void testLengthModifierIsSkipped() {
		FormatDirective directive = FormatDirective.scan("%ld").get(0);
		assertThat(directive.getConversion(), is('d'));
		assertThat(directive.getEnd(), is(3));
	}

	// a newline is a conversion character like any other, and not one that can be rewritten
	@Test
	public void testNewlineConversion() {
		FormatDirective directive = FormatDirective.scan("%\n").get(0);
		assertThat(directive.getConversion(), is('\n'));
		assertFalse(directive.isSubstitution());
	}

	@Test
	public void testNoDirectives() {
		assertThat(FormatDirective.scan("plain text"), is(Collections.<FormatDirective>emptyList()));
		assertThat(FormatDirective.scan("trailing %"), is(Collections.<FormatDirective>emptyList()));
	}

}
