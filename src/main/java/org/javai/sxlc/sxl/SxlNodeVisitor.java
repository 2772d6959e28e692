package org.javai.sxlc.sxl;

/**
 * Visitor interface for SxlNode ASTs, with one method per node kind.
 * 
 * @param <R> the return type of the visitor operations
 */
public interface SxlNodeVisitor<R> {

	R visitProgram(SxlProgram program);

	R visitCall(SxlCallExpression call);

	R visitNumber(SxlNumberLiteral number);

	R visitString(SxlStringLiteral string);
}
