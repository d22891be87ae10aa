package pymig.formatters;

import pymig.model.python.PyBinOp;
import pymig.model.python.PyExpression;
import pymig.model.python.PyStarred;
import pymig.model.python.PyStr;
import pymig.model.python.PyTuple;
import pymig.util.PyStrings;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rewrites {@code '...' % args} into an equivalent f-string, when it can tell the two mean the same: every
 * directive is a positional {@code %s} or {@code %r} (or {@code %%}), there is exactly one argument per directive,
 * and every argument can be written inside a replacement field as it is. Width and precision carry over into the
 * field's format spec.
 */
public class FStringRewriter {

	private static final Logger logger = Logger.getLogger("PyMigMain.rewrite");

	private final PyNodeFormattingVisitor nodes;
	private final LayoutWriter out;
	private final RenderState state;

	public FStringRewriter(PyNodeFormattingVisitor nodes) {
		this.nodes = nodes;
		this.out = nodes.getWriter();
		this.state = nodes.getState();
	}

	private static String escapeLiteral(String text, char quote) {
		return PyStrings.escape(text, quote).replace("{", "{{").replace("}", "}}");
	}

	private static boolean isFormatString(PyExpression expression) {
		return expression instanceof PyStr;
	}

	private boolean skip(SourceLocation location, String reason) {
		logger.fine("kept format expression at " + location.shortString() + ": " + reason);
		return false;
	}

	/**
	 * Writes the f-string for binOp if it is a format expression that can be rewritten.
	 *
	 * @return whether anything was written; if not, binOp is to be rendered as it is
	 */
	public boolean rewrite(PyBinOp binOp) throws IOException {
		if (binOp.getOperation() != PyBinOp.Operation.MOD || !isFormatString(binOp.getLHS())) {
			return false;
		}
		SourceLocation location = binOp.getLocation();
		if (out.hasCommentsWithin(location)) {
			return skip(location, "comments inside");
		}
		String format = ((PyStr) binOp.getLHS()).getValue();
		List<PyExpression> arguments;
		if (binOp.getRHS() instanceof PyTuple) {
			arguments = ((PyTuple) binOp.getRHS()).getElements();
		} else {
			arguments = Collections.singletonList(binOp.getRHS());
		}
		for (PyExpression argument : arguments) {
			if (argument instanceof PyStarred) {
				return skip(location, "unpacked argument");
			}
		}

		// match every directive with its argument before writing anything
		List<FormatDirective> directives = FormatDirective.scan(format);
		Deque<PyExpression> remaining = new ArrayDeque<>(arguments);
		for (FormatDirective directive : directives) {
			if (directive.isLiteralPercent()) {
				continue;
			}
			if (!directive.isSubstitution()) {
				return skip(location, "unsupported directive " + format.substring(directive.getStart(), directive.getEnd()));
			}
			if (remaining.isEmpty()) {
				return skip(location, "not enough arguments");
			}
			remaining.poll();
		}
		if (!remaining.isEmpty()) {
			return skip(location, "too many arguments");
		}

		char quote = state.quote();
		StringBuilder literal = new StringBuilder("f").append(quote);
		int consumed = 0;
		int next = 0;
		for (FormatDirective directive : directives) {
			literal.append(escapeLiteral(format.substring(consumed, directive.getStart()), quote));
			consumed = directive.getEnd();
			if (directive.isLiteralPercent()) {
				literal.append('%');
				continue;
			}
			String field = renderField(arguments.get(next++));
			if (!PyStrings.escape(field, quote).equals(field) || field.indexOf('#') != -1) {
				return skip(location, "argument cannot be written inside a replacement field: " + field);
			}
			literal.append('{');
			if (field.startsWith("{")) {
				literal.append(' ');
			}
			literal.append(field);
			String spec = directive.getFormatSpec();
			if (!spec.isEmpty()) {
				// the spec applies to the converted text, as the directive's padding does
				literal.append('!').append(directive.getConversion()).append(':').append(spec);
			} else if (directive.getConversion() == 'r') {
				literal.append("!r");
			}
			literal.append('}');
		}
		literal.append(escapeLiteral(format.substring(consumed), quote));
		literal.append(quote);

		out.place(literal.toString(), location);
		if (!location.isUnknown()) {
			out.setAnchor(location.getEndLine(), location.getEndColumn());
			out.discardTrivia(location);
		}
		logger.fine("rewrote format expression at " + location.shortString());
		return true;
	}

	private String renderField(PyExpression argument) throws IOException {
		try (LayoutWriter.Capture capture = out.capture();
		     RenderState.Scope fString = state.fString();
		     RenderState.Scope braces = state.braces()) {
			nodes.render(argument);
			return capture.getText();
		}
	}

}
