package pymig;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * The JSON configuration file. Every field is optional:
 *
 * {
 *   "input_file": "module.py",
 *   "output_file": "module_migrated.py",
 *   "window": {"first_line": 10, "last_line": 20}
 * }
 */
public class PyMigConfig {
	public static final String INPUT_FIELD = "input_file";
	public static final String OUTPUT_FIELD = "output_file";
	public static final String WINDOW_FIELD = "window";
	public static final String FIRST_LINE_FIELD = "first_line";
	public static final String LAST_LINE_FIELD = "last_line";

	private final String inputFile;
	private final String outputFile;
	private final boolean windowed;
	private final int firstLine;
	private final int lastLine;

	public PyMigConfig(JSONObject config) throws PyMigOptionException {
		inputFile = optionalString(config, INPUT_FIELD);
		outputFile = optionalString(config, OUTPUT_FIELD);
		if (!config.has(WINDOW_FIELD)) {
			windowed = false;
			firstLine = Integer.MIN_VALUE;
			lastLine = Integer.MAX_VALUE;
			return;
		}
		JSONObject window = config.optJSONObject(WINDOW_FIELD);
		if (window == null) {
			throw new PyMigOptionException(WINDOW_FIELD + " must be an object");
		}
		windowed = true;
		firstLine = optionalInt(window, FIRST_LINE_FIELD, Integer.MIN_VALUE);
		lastLine = optionalInt(window, LAST_LINE_FIELD, Integer.MAX_VALUE);
		if (firstLine > lastLine) {
			throw new PyMigOptionException(WINDOW_FIELD + ": " + FIRST_LINE_FIELD + " is after " + LAST_LINE_FIELD);
		}
	}

	private static String optionalString(JSONObject object, String field) throws PyMigOptionException {
		if (!object.has(field)) {
			return null;
		}
		try {
			return object.getString(field);
		} catch (JSONException e) {
			throw new PyMigOptionException(field + " must be a string");
		}
	}

	private static int optionalInt(JSONObject object, String field, int otherwise) throws PyMigOptionException {
		if (!object.has(field)) {
			return otherwise;
		}
		if (!(object.get(field) instanceof Integer)) {
			throw new PyMigOptionException(WINDOW_FIELD + "." + field + " must be an integer");
		}
		return object.getInt(field);
	}

	public String getInputFile() {
		return inputFile;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public boolean isWindowed() {
		return windowed;
	}

	public int getFirstLine() {
		return firstLine;
	}

	public int getLastLine() {
		return lastLine;
	}
}
