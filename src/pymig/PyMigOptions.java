package pymig;

import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class PyMigOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	// null means standard input and standard output
	public String inputFilePath;
	public String outputFilePath;

	// only output lines in [firstLine, lastLine] are written
	public int firstLine = Integer.MIN_VALUE;
	public int lastLine = Integer.MAX_VALUE;

	private final Options plumeOptions;
	private final String[] args;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public PyMigOptions(String[] args) {
		plumeOptions = new Options("pymig [options] [first_line last_line]", this);
		this.args = args;
	}

	public void parse() throws PyMigOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new PyMigOptionException(e.getMessage());
		}

		if (version) {
			System.out.println("PyMig version " + VERSION);
			System.exit(0);
		}

		if (help) {
			printHelp();
			System.exit(0);
		}

		if (configFilePath != null && !configFilePath.isEmpty()) {
			PyMigConfig config = readConfig(configFilePath);
			inputFilePath = config.getInputFile();
			outputFilePath = config.getOutputFile();
			if (config.isWindowed()) {
				firstLine = config.getFirstLine();
				lastLine = config.getLastLine();
			}
		}

		// anything but two line numbers leaves the window alone
		if (remainingArgs.length == 2) {
			try {
				int first = Integer.parseInt(remainingArgs[0]);
				int last = Integer.parseInt(remainingArgs[1]);
				firstLine = first;
				lastLine = last;
			} catch (NumberFormatException e) {
				Logger.getLogger("PyMigMain.options").fine(
						"ignoring non-numeric line window " + remainingArgs[0] + " " + remainingArgs[1]);
			}
		}
	}

	static PyMigConfig readConfig(String path) throws PyMigOptionException {
		String s;
		try {
			byte[] jsonBytes = Files.readAllBytes(Paths.get(path));
			s = new String(jsonBytes, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new PyMigOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new PyMigOptionException(path + ": parsing error: " + e.getMessage());
		}
		return new PyMigConfig(config);
	}
}
