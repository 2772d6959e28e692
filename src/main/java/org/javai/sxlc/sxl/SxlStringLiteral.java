package org.javai.sxlc.sxl;

import java.util.Objects;

/**
 * The text between a pair of double quotes, stored without the quotes.
 */
public record SxlStringLiteral(String value) implements SxlNode {

	public SxlStringLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public <R> R accept(SxlNodeVisitor<R> visitor) {
		return visitor.visitString(this);
	}
}
