package pymig.formatters;

import pymig.PyMigException;
import pymig.model.python.PyNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A failure while rendering a tree. Carries the chain of nodes that were being rendered, innermost first.
 */
public class RenderException extends PyMigException {

	private static final long serialVersionUID = -3145530923021386717L;
	private static final String prefix = "Render Error";

	private final List<PyNode> nodes = new ArrayList<>();

	public RenderException(String msg) {
		super(prefix, msg);
	}

	public RenderException(Throwable cause) {
		super(prefix, cause.toString(), cause);
	}

	/**
	 * Records that the failure happened while rendering node.
	 */
	public RenderException within(PyNode node) {
		nodes.add(node);
		return this;
	}

	public List<PyNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

}
