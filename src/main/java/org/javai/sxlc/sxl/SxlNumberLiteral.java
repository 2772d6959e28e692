package org.javai.sxlc.sxl;

import java.util.Objects;

/**
 * A digit run, stored verbatim.
 */
public record SxlNumberLiteral(String value) implements SxlNode {

	public SxlNumberLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public <R> R accept(SxlNodeVisitor<R> visitor) {
		return visitor.visitNumber(this);
	}
}
