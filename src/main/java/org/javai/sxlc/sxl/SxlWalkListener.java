package org.javai.sxlc.sxl;

/**
 * Enter/exit hooks invoked by {@link SxlNodeWalker} during a depth-first walk.
 * 
 * <p>Every hook is optional. A context value of type {@code C} is threaded
 * through the walk: the {@code enter} hook of a node with children returns
 * the context passed to those children, and the matching {@code exit} hook
 * receives the context the node was entered with. The defaults pass the
 * context through unchanged.</p>
 * 
 * @param <C> the type of the context value threaded through the walk
 */
public interface SxlWalkListener<C> {

	default C enterProgram(SxlProgram program, C context) {
		return context;
	}

	default void exitProgram(SxlProgram program, C context) {
	}

	default C enterCall(SxlCallExpression call, SxlNode parent, C context) {
		return context;
	}

	default void exitCall(SxlCallExpression call, SxlNode parent, C context) {
	}

	default void enterNumber(SxlNumberLiteral number, SxlNode parent, C context) {
	}

	default void exitNumber(SxlNumberLiteral number, SxlNode parent, C context) {
	}

	default void enterString(SxlStringLiteral string, SxlNode parent, C context) {
	}

	default void exitString(SxlStringLiteral string, SxlNode parent, C context) {
	}
}
