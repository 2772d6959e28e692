package org.javai.sxlc.sxl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser for SXL.
 * 
 * <pre>
 * Program := Node*
 * Node    := NUMBER | STRING | Call
 * Call    := '(' NAME Node* ')'
 * </pre>
 * 
 * The parser reads one token at a time with no backtracking. Each call to
 * {@code parseNode} consumes exactly one construct. Nesting depth is bounded
 * by the JVM stack.
 * 
 * Example usage:
 * 
 * <pre>
 * List&lt;SxlToken&gt; tokens = new SxlTokenizer("(add 2 (subtract 4 3))").tokenize();
 * SxlProgram program = new SxlParser(tokens).parse();
 * </pre>
 */
public class SxlParser {

	private final List<SxlToken> tokens;

	/**
	 * Creates a parser over the given tokens.
	 * 
	 * @param tokens the tokens to parse
	 */
	public SxlParser(List<SxlToken> tokens) {
		this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens must not be null"));
	}

	/**
	 * Parses the tokens into a program.
	 * 
	 * @return the program root (its body may be empty)
	 * @throws SxlParseException if the tokens do not match the grammar
	 */
	public SxlProgram parse() {
		ParserState state = new ParserState(tokens);
		List<SxlNode> body = new ArrayList<>();

		while (!state.isAtEnd()) {
			body.add(parseNode(state));
		}

		return new SxlProgram(body);
	}

	private SxlNode parseNode(ParserState state) {
		SxlToken token = state.peek();

		return switch (token.type()) {
			case NUMBER -> {
				state.advance();
				yield new SxlNumberLiteral(token.value());
			}
			case STRING -> {
				state.advance();
				yield new SxlStringLiteral(token.value());
			}
			case LPAREN -> parseCall(state);
			case RPAREN -> throw new SxlParseException(
				"Unexpected ')' at position " + token.position() + ": no matching opening parenthesis",
				token.type(), token.position());
			case NAME -> throw new SxlParseException(
				"Unexpected name '" + token.value() + "' at position " + token.position()
					+ ": names may only follow '('",
				token.type(), token.position());
		};
	}

	private SxlCallExpression parseCall(ParserState state) {
		int startPos = state.peek().position();
		state.advance(); // consume '('

		if (state.isAtEnd()) {
			throw unmatched(startPos);
		}

		SxlToken nameToken = state.peek();
		if (!nameToken.isType(SxlToken.TokenType.NAME)) {
			throw new SxlParseException(
				"Expected name after '(' at position " + startPos + ", found: " + nameToken.type(),
				nameToken.type(), nameToken.position());
		}
		state.advance();

		List<SxlNode> params = new ArrayList<>();
		while (!state.check(SxlToken.TokenType.RPAREN)) {
			if (state.isAtEnd()) {
				throw unmatched(startPos);
			}
			params.add(parseNode(state));
		}

		state.advance(); // consume ')'
		return new SxlCallExpression(nameToken.value(), params);
	}

	private static SxlParseException unmatched(int startPos) {
		return new SxlParseException(
			"Unmatched '(' at position " + startPos + ": reached end of input", null, startPos);
	}

	/**
	 * Cursor over the token list.
	 */
	static final class ParserState {

		private final List<SxlToken> tokens;
		private int current = 0;

		ParserState(List<SxlToken> tokens) {
			this.tokens = tokens;
		}

		SxlToken peek() {
			return tokens.get(current);
		}

		SxlToken advance() {
			if (!isAtEnd()) {
				current++;
			}
			return tokens.get(current - 1);
		}

		boolean check(SxlToken.TokenType type) {
			if (isAtEnd()) return false;
			return peek().type() == type;
		}

		boolean isAtEnd() {
			return current >= tokens.size();
		}
	}
}
