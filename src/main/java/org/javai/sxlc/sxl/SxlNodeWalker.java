package org.javai.sxlc.sxl;

import java.util.List;
import java.util.Objects;

/**
 * Walks SxlNode ASTs depth-first, pre-order, reporting each node to a
 * {@link SxlWalkListener}.
 * 
 * <p>For every node the listener's {@code enter} hook runs first, then the
 * children are walked left to right ({@code body} of a program, {@code params}
 * of a call), then the {@code exit} hook runs. The root is reported with a
 * {@code null} parent.</p>
 * 
 * <p>Recursion depth equals the nesting depth of the tree; extremely deep
 * trees end in {@link StackOverflowError}.</p>
 */
public final class SxlNodeWalker {

	private SxlNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks a whole program.
	 * 
	 * @param <C> the context type
	 * @param program the root to walk
	 * @param listener the hooks to invoke
	 * @param initialContext the context the root is entered with; may be {@code null}
	 */
	public static <C> void traverse(SxlProgram program, SxlWalkListener<C> listener, C initialContext) {
		Objects.requireNonNull(program, "program must not be null");
		Objects.requireNonNull(listener, "listener must not be null");
		walk(program, null, listener, initialContext);
	}

	/**
	 * Walks a program with a {@code null} context, for listeners that do not use one.
	 */
	public static void traverse(SxlProgram program, SxlWalkListener<?> listener) {
		traverse(program, listener, null);
	}

	/**
	 * Walks any subtree, reporting {@code parent} as the parent of {@code node}.
	 */
	public static <C> void walk(SxlNode node, SxlNode parent, SxlWalkListener<C> listener, C context) {
		if (node == null) {
			throw new IllegalArgumentException("Cannot walk a null node (child of " + describe(parent) + ")");
		}
		node.accept(new Step<>(parent, listener, context));
	}

	private static <C> void walkAll(List<SxlNode> nodes, SxlNode parent, SxlWalkListener<C> listener, C context) {
		for (SxlNode child : nodes) {
			walk(child, parent, listener, context);
		}
	}

	private static String describe(SxlNode node) {
		return node == null ? "no parent" : node.getClass().getSimpleName();
	}

	/**
	 * Visits a single node: enter, children, exit.
	 */
	private static final class Step<C> implements SxlNodeVisitor<Void> {

		private final SxlNode parent;
		private final SxlWalkListener<C> listener;
		private final C context;

		private Step(SxlNode parent, SxlWalkListener<C> listener, C context) {
			this.parent = parent;
			this.listener = listener;
			this.context = context;
		}

		@Override
		public Void visitProgram(SxlProgram program) {
			C childContext = listener.enterProgram(program, context);
			walkAll(program.body(), program, listener, childContext);
			listener.exitProgram(program, context);
			return null;
		}

		@Override
		public Void visitCall(SxlCallExpression call) {
			C childContext = listener.enterCall(call, parent, context);
			walkAll(call.params(), call, listener, childContext);
			listener.exitCall(call, parent, context);
			return null;
		}

		@Override
		public Void visitNumber(SxlNumberLiteral number) {
			listener.enterNumber(number, parent, context);
			listener.exitNumber(number, parent, context);
			return null;
		}

		@Override
		public Void visitString(SxlStringLiteral string) {
			listener.enterString(string, parent, context);
			listener.exitString(string, parent, context);
			return null;
		}
	}
}
