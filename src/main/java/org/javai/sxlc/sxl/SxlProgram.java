package org.javai.sxlc.sxl;

import java.util.List;

/**
 * Root of a parsed SXL source: the top-level forms in source order.
 */
public record SxlProgram(List<SxlNode> body) implements SxlNode {

	public SxlProgram {
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(SxlNodeVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}
}
