package org.javai.sxlc.target;

import java.util.Objects;

public record TargetIdentifier(String name) implements TargetNode {

	public TargetIdentifier {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public <R> R accept(TargetNodeVisitor<R> visitor) {
		return visitor.visitIdentifier(this);
	}
}
