package pymig;

import static org.junit.Assert.*;

import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class PyMigMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File config(File input, File output) throws IOException {
		JSONObject config = new JSONObject();
		config.put(PyMigConfig.INPUT_FIELD, input.getPath());
		config.put(PyMigConfig.OUTPUT_FIELD, output.getPath());
		File configFile = folder.newFile("config.json");
		Files.write(configFile.toPath(), config.toString().getBytes(StandardCharsets.UTF_8));
		return configFile;
	}

	private static String read(File file) throws IOException {
		return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
	}

	@Test
	public void testMigratesFile() throws IOException {
		File input = folder.newFile("greeting.py");
		Files.write(input.toPath(), (
				"def say(greeting='hello', target='world'):\n" +
				"    # greet someone\n" +
				"    print(\"%s%s, %s!\" % (greeting[0].upper(), greeting[1:], target))\n"
		).getBytes(StandardCharsets.UTF_8));
		File output = new File(folder.getRoot(), "greeting_migrated.py");

		assertTrue(new PyMigMain(new String[] {"-q", "-c", config(input, output).getPath()}).run());
		assertEquals(
				"def say(greeting='hello', target='world'):\n" +
				"    # greet someone\n" +
				"    print(f'{greeting[0].upper()}{greeting[1:]}, {target}!')\n",
				read(output));
	}

	@Test
	public void testWindowOnCommandLine() throws IOException {
		File input = folder.newFile("lines.py");
		Files.write(input.toPath(), "a = 1\nb = '%s' % (a,)\nc = 3\n".getBytes(StandardCharsets.UTF_8));
		File output = new File(folder.getRoot(), "lines_migrated.py");

		assertTrue(new PyMigMain(new String[] {"-q", "-c", config(input, output).getPath(), "2", "2"}).run());
		assertEquals("b = f'{a}'\n", read(output));
	}

	@Test
	public void testSyntaxErrorFails() throws IOException {
		File input = folder.newFile("broken.py");
		Files.write(input.toPath(), "def f(:\n".getBytes(StandardCharsets.UTF_8));
		File output = new File(folder.getRoot(), "broken_migrated.py");

		assertFalse(new PyMigMain(new String[] {"-q", "-c", config(input, output).getPath()}).run());
		assertFalse(output.exists());
	}

	@Test
	public void testMissingInputFails() throws IOException {
		File input = new File(folder.getRoot(), "missing.py");
		File output = new File(folder.getRoot(), "missing_migrated.py");

		assertFalse(new PyMigMain(new String[] {"-q", "-c", config(input, output).getPath()}).run());
	}

	@Test
	public void testBadOptionFails() {
		assertFalse(new PyMigMain(new String[] {"-q", "--no-such-option"}).run());
	}

}
