package org.javai.sxlc.target;

/**
 * Visitor interface for TargetNode ASTs, with one method per node kind.
 * 
 * @param <R> the return type of the visitor operations
 */
public interface TargetNodeVisitor<R> {

	R visitProgram(TargetProgram program);

	R visitExpressionStatement(TargetExpressionStatement statement);

	R visitCall(TargetCallExpression call);

	R visitIdentifier(TargetIdentifier identifier);

	R visitNumber(TargetNumberLiteral number);

	R visitString(TargetStringLiteral string);
}
