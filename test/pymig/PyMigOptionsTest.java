package pymig;

import static org.junit.Assert.*;

import org.junit.Test;

public class PyMigOptionsTest {

	private static PyMigOptions parse(String... args) throws PyMigOptionException {
		PyMigOptions opts = new PyMigOptions(args);
		opts.parse();
		return opts;
	}

	@Test
	public void testDefaults() throws PyMigOptionException {
		PyMigOptions opts = parse();
		assertNull(opts.inputFilePath);
		assertNull(opts.outputFilePath);
		assertEquals(Integer.MIN_VALUE, opts.firstLine);
		assertEquals(Integer.MAX_VALUE, opts.lastLine);
		assertFalse(opts.logLvlQuiet);
		assertFalse(opts.logLvlVerbose);
	}

	@Test
	public void testWindowArguments() throws PyMigOptionException {
		PyMigOptions opts = parse("3", "7");
		assertEquals(3, opts.firstLine);
		assertEquals(7, opts.lastLine);
	}

	// anything but two line numbers is ignored
	@Test
	public void testMalformedWindowArguments() throws PyMigOptionException {
		PyMigOptions opts = parse("3", "x");
		assertEquals(Integer.MIN_VALUE, opts.firstLine);
		assertEquals(Integer.MAX_VALUE, opts.lastLine);
		opts = parse("3");
		assertEquals(Integer.MIN_VALUE, opts.firstLine);
	}

	@Test
	public void testFlags() throws PyMigOptionException {
		assertTrue(parse("-q").logLvlQuiet);
		assertTrue(parse("-v").logLvlVerbose);
	}

	@Test
	public void testConfigFile() throws PyMigOptionException {
		PyMigOptions opts = parse("-c", "./examples/configs/migrate.json");
		assertEquals("greeting.py", opts.inputFilePath);
		assertEquals("greeting_migrated.py", opts.outputFilePath);
		assertEquals(3, opts.firstLine);
		assertEquals(12, opts.lastLine);
	}

	// line numbers on the command line win over the configuration file
	@Test
	public void testArgumentsOverrideConfigWindow() throws PyMigOptionException {
		PyMigOptions opts = parse("-c", "./examples/configs/migrate.json", "5", "6");
		assertEquals(5, opts.firstLine);
		assertEquals(6, opts.lastLine);
	}

	@Test
	public void testMalformedArgumentsKeepConfigWindow() throws PyMigOptionException {
		PyMigOptions opts = parse("-c", "./examples/configs/migrate.json", "foo", "bar");
		assertEquals(3, opts.firstLine);
		assertEquals(12, opts.lastLine);
		opts = parse("-c", "./examples/configs/migrate.json", "5", "x");
		assertEquals(3, opts.firstLine);
		assertEquals(12, opts.lastLine);
	}

	@Test(expected = PyMigOptionException.class)
	public void testMissingConfigFile() throws PyMigOptionException {
		parse("-c", "./examples/configs/does-not-exist.json");
	}

	@Test(expected = PyMigOptionException.class)
	public void testUnknownOption() throws PyMigOptionException {
		parse("--no-such-option");
	}

}
