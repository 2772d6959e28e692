package org.javai.sxlc.sxl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tokenizer for SXL source.
 * Converts input string into a flat list of tokens in source order.
 * 
 * <p>A digit run ends at the first non-digit, so {@code 1a} yields
 * {@code NUMBER(1)} followed by {@code NAME(a)}. Strings have no escape
 * sequences: everything up to the next {@code "} is taken verbatim.
 * Whitespace, including no-break spaces and U+FEFF, only separates tokens.</p>
 */
public class SxlTokenizer {

	private final String input;
	private int pos = 0;

	public SxlTokenizer(String input) {
		this.input = Objects.requireNonNull(input, "input must not be null");
	}

	/**
	 * Tokenizes the entire input string.
	 * 
	 * @return list of tokens (empty for blank input)
	 * @throws SxlLexException if a character cannot be classified or a string is not terminated
	 */
	public List<SxlToken> tokenize() {
		List<SxlToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		return tokens;
	}

	private SxlToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new SxlToken(SxlToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new SxlToken(SxlToken.TokenType.RPAREN, ")", start);
			}
			case '"' -> scanString();
			default -> {
				if (isDigit(c)) {
					yield scanNumber();
				} else if (isLetter(c)) {
					yield scanName();
				} else {
					throw new SxlLexException("Unrecognized character: '" + c + "' at position " + pos, c, pos);
				}
			}
		};
	}

	private SxlToken scanString() {
		int start = pos;
		advance(); // consume opening "

		while (!isAtEnd() && peek() != '"') {
			advance();
		}

		if (isAtEnd()) {
			throw new SxlLexException("Unterminated string at position " + start, '"', start);
		}

		String value = input.substring(start + 1, pos);
		advance(); // consume closing "
		return new SxlToken(SxlToken.TokenType.STRING, value, start);
	}

	private SxlToken scanNumber() {
		int start = pos;
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		return new SxlToken(SxlToken.TokenType.NUMBER, input.substring(start, pos), start);
	}

	private SxlToken scanName() {
		int start = pos;
		while (!isAtEnd() && isLetter(peek())) {
			advance();
		}
		return new SxlToken(SxlToken.TokenType.NAME, input.substring(start, pos), start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	// Unicode space separators (no-break spaces included) and the byte order mark count as whitespace
	private boolean isWhitespace(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
