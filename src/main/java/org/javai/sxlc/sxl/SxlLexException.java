package org.javai.sxlc.sxl;

import org.javai.sxlc.SxlCompileException;

/**
 * Exception thrown when the tokenizer meets a character it cannot classify,
 * or a string literal that is never closed.
 */
public class SxlLexException extends SxlCompileException {

	private final char character;
	private final int position;

	public SxlLexException(String message, char character, int position) {
		super(message);
		this.character = character;
		this.position = position;
	}

	/**
	 * The offending character. For an unterminated string this is the opening quote.
	 */
	public char getCharacter() {
		return character;
	}

	/**
	 * Zero-based offset of {@link #getCharacter()} in the source text.
	 */
	public int getPosition() {
		return position;
	}
}
