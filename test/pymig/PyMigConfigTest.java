package pymig;

import static org.junit.Assert.*;

import org.apache.commons.io.IOUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class PyMigConfigTest {

	// parsed JSON object for the configuration file used in the tests
	private JSONObject config;

	@Before
	public void setup() throws IOException {
		try (FileInputStream configIs = new FileInputStream("./examples/configs/migrate.json")) {
			config = new JSONObject(IOUtils.toString(configIs, StandardCharsets.UTF_8));
		}
	}

	private JSONObject getWindow() {
		return config.getJSONObject(PyMigConfig.WINDOW_FIELD);
	}

	@Test
	public void testFullConfig() throws PyMigOptionException {
		PyMigConfig parsed = new PyMigConfig(config);
		assertEquals("greeting.py", parsed.getInputFile());
		assertEquals("greeting_migrated.py", parsed.getOutputFile());
		assertTrue(parsed.isWindowed());
		assertEquals(3, parsed.getFirstLine());
		assertEquals(12, parsed.getLastLine());
	}

	// every field is optional
	@Test
	public void testEmptyConfig() throws PyMigOptionException {
		PyMigConfig parsed = new PyMigConfig(new JSONObject());
		assertNull(parsed.getInputFile());
		assertNull(parsed.getOutputFile());
		assertFalse(parsed.isWindowed());
		assertEquals(Integer.MIN_VALUE, parsed.getFirstLine());
		assertEquals(Integer.MAX_VALUE, parsed.getLastLine());
	}

	// a window with only one bound is open on the other side
	@Test
	public void testOpenWindow() throws PyMigOptionException {
		getWindow().remove(PyMigConfig.LAST_LINE_FIELD);
		PyMigConfig parsed = new PyMigConfig(config);
		assertEquals(3, parsed.getFirstLine());
		assertEquals(Integer.MAX_VALUE, parsed.getLastLine());
	}

	@Test(expected = PyMigOptionException.class)
	public void testInputFileMustBeString() throws PyMigOptionException {
		config.put(PyMigConfig.INPUT_FIELD, 42);
		new PyMigConfig(config);
	}

	@Test(expected = PyMigOptionException.class)
	public void testWindowMustBeObject() throws PyMigOptionException {
		config.put(PyMigConfig.WINDOW_FIELD, "3-12");
		new PyMigConfig(config);
	}

	@Test(expected = PyMigOptionException.class)
	public void testLineMustBeInteger() throws PyMigOptionException {
		getWindow().put(PyMigConfig.FIRST_LINE_FIELD, "three");
		new PyMigConfig(config);
	}

	@Test(expected = PyMigOptionException.class)
	public void testReversedWindow() throws PyMigOptionException {
		getWindow().put(PyMigConfig.FIRST_LINE_FIELD, 20);
		new PyMigConfig(config);
	}

}
