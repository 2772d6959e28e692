package org.javai.sxlc.sxl;

import java.util.List;
import java.util.Objects;

/**
 * A parenthesized call form such as {@code (add 1 2)}.
 * 
 * @param name the callee name, kept as plain text
 * @param params the positional arguments
 */
public record SxlCallExpression(String name, List<SxlNode> params) implements SxlNode {

	public SxlCallExpression {
		Objects.requireNonNull(name, "name must not be null");
		params = List.copyOf(params);
	}

	@Override
	public <R> R accept(SxlNodeVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
