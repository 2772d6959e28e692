package org.javai.sxlc.target;

import java.util.List;
import java.util.Objects;

/**
 * A call such as {@code add(1, 2)}.
 * 
 * <p>{@code arguments} is copied on construction.</p>
 */
public record TargetCallExpression(TargetIdentifier callee, List<TargetNode> arguments) implements TargetNode {

	public TargetCallExpression {
		Objects.requireNonNull(callee, "callee must not be null");
		arguments = List.copyOf(arguments);
	}

	@Override
	public <R> R accept(TargetNodeVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
