package pymig.formatters;

import pymig.model.python.PyExpression;
import pymig.util.SourceLocation;

import java.io.IOException;

/**
 * Wraps the rendering of an expression in parentheses when its context requires them. Closing writes the
 * closing parenthesis, if one was opened, and restores the render state.
 */
public class AutoParens implements AutoCloseable {

	private final LayoutWriter out;
	private final RenderState.Scope scope;
	private final boolean parens;

	private AutoParens(LayoutWriter out, RenderState.Scope scope, boolean parens) {
		this.out = out;
		this.scope = scope;
		this.parens = parens;
	}

	/**
	 * Opens parentheses around node when the stack top asks for tighter binding than level, or when the node
	 * spans lines outside of any brackets and the text before it is gone (see
	 * {@link LayoutWriter#isDetached(int, int)}). Without parentheses the surrounding precedence stays in effect
	 * for the caller to refine.
	 *
	 * @param spansLines whether the first and last operand of the node start on different lines
	 */
	public static AutoParens open(LayoutWriter out, RenderState state, PyExpression node, int level,
	                              boolean spansLines) throws IOException {
		boolean grouped = !out.isCapturing() && state.isGrouped(node);
		if (grouped) {
			// the source's own parentheses are written as trivia
			return new AutoParens(out, state.bracket(), false);
		}
		SourceLocation location = node.getLocation();
		boolean layout = spansLines && state.getParenDepth() == 0 && location != null
				&& out.isDetached(location.getStartLine(), location.getStartColumn());
		if (layout || state.top() > level) {
			if (location == null || location.isUnknown()) {
				out.emit(out.isAfterWord() ? " (" : "(");
			} else {
				out.place("(", location);
			}
			return new AutoParens(out, state.bracket(), true);
		}
		return new AutoParens(out, null, false);
	}

	public static AutoParens open(LayoutWriter out, RenderState state, PyExpression node, int level)
			throws IOException {
		return open(out, state, node, level, false);
	}

	public boolean isParenthesized() {
		return parens;
	}

	@Override
	public void close() throws IOException {
		if (scope != null) {
			scope.close();
		}
		if (parens) {
			out.emit(")");
		}
	}

}
