package org.javai.sxlc.sxl;

/**
 * Represents a node in the parsed SXL AST.
 * 
 * The set of node kinds is closed: a program root, call expressions, and
 * number and string literals. Operations over the tree are written as
 * {@link SxlNodeVisitor}s, so adding a kind breaks every visitor at compile time.
 */
public sealed interface SxlNode permits SxlProgram, SxlCallExpression, SxlNumberLiteral, SxlStringLiteral {

	/**
	 * Accepts a visitor and dispatches to the visitor method for this node's kind.
	 * 
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(SxlNodeVisitor<R> visitor);
}
