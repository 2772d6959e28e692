package org.javai.sxlc.target;

/**
 * Represents a node of the C-style call-expression AST produced by the transformer.
 * 
 * The node kinds mirror the target grammar: a program of statements, expression
 * statements wrapping top-level calls, calls with an identifier callee, and literals.
 */
public sealed interface TargetNode permits TargetProgram, TargetExpressionStatement, TargetCallExpression,
		TargetIdentifier, TargetNumberLiteral, TargetStringLiteral {

	<R> R accept(TargetNodeVisitor<R> visitor);
}
