package org.javai.sxlc.sxl;

/**
 * Represents a token of SXL source.
 * 
 * @param type the token type
 * @param value the token text; the literal character for parentheses, the
 *        contents without quotes for strings
 * @param position the character position in the input string
 */
public record SxlToken(TokenType type, String value, int position) {

	public enum TokenType {
		LPAREN,        // (
		RPAREN,        // )
		NUMBER,        // run of ASCII digits
		STRING,        // "double quoted", no escapes
		NAME           // run of ASCII letters
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case NUMBER, NAME -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
