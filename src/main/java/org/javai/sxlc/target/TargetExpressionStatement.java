package org.javai.sxlc.target;

import java.util.Objects;

/**
 * Wraps a call that is not itself an argument, so that it renders as a statement.
 */
public record TargetExpressionStatement(TargetNode expression) implements TargetNode {

	public TargetExpressionStatement {
		Objects.requireNonNull(expression, "expression must not be null");
	}

	@Override
	public <R> R accept(TargetNodeVisitor<R> visitor) {
		return visitor.visitExpressionStatement(this);
	}
}
