package pymig.formatters;

import pymig.model.python.PyExpression;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * What an expression needs to know about its surroundings while it is rendered: the precedence its context
 * demands, how many brackets enclose it, and how deeply it is nested in f-strings being built.
 *
 * The precedence stack starts with, and never drops below, a sentinel of -1, which no operator level is below.
 */
public class RenderState {

	public static final int SENTINEL = -1;

	private final Deque<Integer> precedence = new ArrayDeque<>();
	private final Set<PyExpression> grouped;
	private int parenDepth = 0;
	private int fStringDepth = 0;

	/**
	 * A scope on the state, undone on close.
	 */
	public static class Scope implements AutoCloseable {
		private final Runnable undo;

		private Scope(Runnable undo) {
			this.undo = undo;
		}

		@Override
		public void close() {
			undo.run();
		}
	}

	public RenderState() {
		this(Collections.emptySet());
	}

	public RenderState(Set<PyExpression> grouped) {
		this.grouped = Collections.newSetFromMap(new IdentityHashMap<>());
		this.grouped.addAll(grouped);
		precedence.push(SENTINEL);
	}

	public int top() {
		return precedence.peek();
	}

	public int getParenDepth() {
		return parenDepth;
	}

	public int getFStringDepth() {
		return fStringDepth;
	}

	/**
	 * @return whether the source wraps expression in grouping parentheses of its own
	 */
	public boolean isGrouped(PyExpression expression) {
		return grouped.contains(expression);
	}

	private Scope push(int level, int depth) {
		precedence.push(level);
		parenDepth += depth;
		return new Scope(() -> {
			precedence.pop();
			parenDepth -= depth;
		});
	}

	/**
	 * Operands rendered in this scope need parentheses when they bind less tightly than level.
	 */
	public Scope level(int level) {
		return push(level, 0);
	}

	/**
	 * Parentheses, call arguments, subscripts and displays: anything goes inside, across lines too.
	 */
	public Scope bracket() {
		return push(SENTINEL, 1);
	}

	/**
	 * The braces of an f-string replacement field. A lambda has to be parenthesized there.
	 */
	public Scope braces() {
		return push(PyPrecedence.CONDITIONAL, 1);
	}

	/**
	 * Rendering an argument of an f-string under construction.
	 */
	public Scope fString() {
		fStringDepth++;
		return new Scope(() -> fStringDepth--);
	}

	/**
	 * @return the quote character of an f-string built at the current nesting, which is also the one strings
	 * written there must avoid
	 */
	public char quote() {
		return fStringDepth % 2 == 0 ? '\'' : '"';
	}

}
