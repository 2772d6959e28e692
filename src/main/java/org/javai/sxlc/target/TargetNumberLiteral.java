package org.javai.sxlc.target;

import java.util.Objects;

public record TargetNumberLiteral(String value) implements TargetNode {

	public TargetNumberLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public <R> R accept(TargetNodeVisitor<R> visitor) {
		return visitor.visitNumber(this);
	}
}
