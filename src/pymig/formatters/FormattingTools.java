package pymig.formatters;

import java.io.IOException;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T param) throws IOException;
	}

	/**
	 * Writes items separated by commas, each comma where the source has it.
	 */
	public static <T> void writeCommaSeparated(LayoutWriter out, List<T> items, Formatter<T> writer)
			throws IOException {
		boolean isFirst = true;
		for (T item : items) {
			if (!isFirst) {
				out.token(",", ", ");
			}
			isFirst = false;
			writer.format(item);
		}
	}

}
