package org.javai.sxlc.target;

import java.util.Objects;

/**
 * String literal; {@code value} excludes the quotes.
 */
public record TargetStringLiteral(String value) implements TargetNode {

	public TargetStringLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public <R> R accept(TargetNodeVisitor<R> visitor) {
		return visitor.visitString(this);
	}
}
