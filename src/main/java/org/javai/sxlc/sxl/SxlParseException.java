package org.javai.sxlc.sxl;

import org.javai.sxlc.SxlCompileException;

/**
 * Exception thrown when a token sequence does not match the SXL grammar.
 */
public class SxlParseException extends SxlCompileException {

	private final SxlToken.TokenType tokenType;
	private final int position;

	public SxlParseException(String message, SxlToken.TokenType tokenType, int position) {
		super(message);
		this.tokenType = tokenType;
		this.position = position;
	}

	/**
	 * Type of the unexpected token, or {@code null} when the input ended inside a construct.
	 */
	public SxlToken.TokenType getTokenType() {
		return tokenType;
	}

	/**
	 * Source offset of the unexpected token. When the input ended early, this is
	 * the position of the '(' that was never closed.
	 */
	public int getPosition() {
		return position;
	}

	public boolean isEndOfInput() {
		return tokenType == null;
	}
}
