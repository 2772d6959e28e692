package org.javai.sxlc.target;

import java.util.List;

/**
 * Root of the target AST.
 * 
 * <p>{@code body} is copied on construction; later changes to the caller's list
 * are not seen by the node.</p>
 */
public record TargetProgram(List<TargetNode> body) implements TargetNode {

	public TargetProgram {
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(TargetNodeVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}
}
