package pymig.model.python;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * A parsed Python module together with everything a layout-preserving printer needs besides the tree: the
 * source lines, the trivia, and which expressions the source wraps in grouping parentheses.
 */
public class PySourceFile {

	private final Path path;
	private final String text;
	private final List<String> lines;
	private final PyModule module;
	private final List<PyTrivia> trivia;
	private final Set<PyExpression> grouped;

	public PySourceFile(Path path, String text, PyModule module, List<PyTrivia> trivia, Set<PyExpression> grouped) {
		this.path = path;
		this.text = text;
		this.lines = Collections.unmodifiableList(Arrays.asList(text.split("\n", -1)));
		this.module = module;
		List<PyTrivia> sorted = new ArrayList<>(trivia);
		sorted.sort((a, b) -> a.getLocation().compareTo(b.getLocation()));
		this.trivia = Collections.unmodifiableList(sorted);
		Set<PyExpression> groupedCopy = Collections.newSetFromMap(new IdentityHashMap<>());
		groupedCopy.addAll(grouped);
		this.grouped = Collections.unmodifiableSet(groupedCopy);
	}

	public Path getPath() {
		return path;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the source split at "\n"; a trailing newline yields a final empty line
	 */
	public List<String> getLines() {
		return lines;
	}

	public PyModule getModule() {
		return module;
	}

	public List<PyTrivia> getTrivia() {
		return trivia;
	}

	public Set<PyExpression> getGroupedExpressions() {
		return grouped;
	}

}
