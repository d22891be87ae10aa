package pymig.util;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class PyStringsTest {

	@Test
	public void testEscape() {
		assertThat(PyStrings.escape("plain"), is("plain"));
		assertThat(PyStrings.escape("it's \"x\""), is("it\\'s \"x\""));
		assertThat(PyStrings.escape("it's \"x\"", '"'), is("it's \\\"x\\\""));
		assertThat(PyStrings.escape("a\\b\tc\nd\re"), is("a\\\\b\\tc\\nd\\re"));
		assertThat(PyStrings.escape("\u0000\u007f\u0085"), is("\\x00\\x7f\\x85"));
		assertThat(PyStrings.escape("\u00e9\u2028"), is("\u00e9\\u2028"));
		assertThat(PyStrings.escape(new String(Character.toChars(0xe0001))), is("\\U000e0001"));
	}

	@Test
	public void testQuote() {
		assertThat(PyStrings.quote("k", '\''), is("'k'"));
		assertThat(PyStrings.quote("k", '"'), is("\"k\""));
		assertThat(PyStrings.quote("it's", '\''), is("\"it's\""));
		assertThat(PyStrings.quote("it's \"x\"", '\''), is("'it\\'s \"x\"'"));
	}

	@Test
	public void testPrefix() {
		assertThat(PyStrings.prefix("'x'"), is(""));
		assertThat(PyStrings.prefix("Rb'x'"), is("rb"));
		assertThat(PyStrings.prefix("f\"{x}\""), is("f"));
	}

	@Test
	public void testDecode() {
		assertThat(PyStrings.decode("'a\\'b'"), is("a'b"));
		assertThat(PyStrings.decode("\"\\x41\\u00e9\\101\\n\""), is("A\u00e9A\n"));
		assertThat(PyStrings.decode("r'\\d'"), is("\\d"));
		assertThat(PyStrings.decode("'''two\nlines'''"), is("two\nlines"));
		assertThat(PyStrings.decode("'\\q'"), is("\\q"));
		assertThat(PyStrings.decode("'\\N{BULLET}'"), is("\u2022"));
		assertThat(PyStrings.decode("'line\\\ncontinued'"), is("linecontinued"));
	}

}
