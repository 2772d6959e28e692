package org.javai.sxlc;

import java.util.List;
import java.util.Objects;
import org.javai.sxlc.sxl.SxlNodeWalker;
import org.javai.sxlc.sxl.SxlParser;
import org.javai.sxlc.sxl.SxlProgram;
import org.javai.sxlc.sxl.SxlToken;
import org.javai.sxlc.sxl.SxlTokenizer;
import org.javai.sxlc.sxl.SxlWalkListener;
import org.javai.sxlc.target.CodeGenerator;
import org.javai.sxlc.target.TargetNode;
import org.javai.sxlc.target.TargetProgram;
import org.javai.sxlc.transform.SxlToTargetTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles SXL source into C-style call expressions.
 * 
 * <p>{@code (add 2 (subtract 4 3))} compiles to {@code add(2, subtract(4, 3));}.</p>
 * 
 * <p>{@link #compile(String)} runs the stages in order: tokenize, parse,
 * transform, generate. Each stage is also exposed on its own. The first
 * error from any stage is propagated as thrown; nothing is wrapped.</p>
 * 
 * <p>Instances hold only immutable settings and may be shared between threads.</p>
 * 
 * Example usage:
 * 
 * <pre>
 * SxlCompiler compiler = new SxlCompiler();
 * String code = compiler.compile("(cry 10 5)"); // "cry(10, 5);"
 * 
 * SxlCompiler oneLine = SxlCompiler.builder()
 *     .statementSeparator(" ")
 *     .build();
 * </pre>
 */
public class SxlCompiler {

	private static final Logger logger = LoggerFactory.getLogger(SxlCompiler.class);

	private final String statementSeparator;

	public SxlCompiler() {
		this(builder());
	}

	private SxlCompiler(Builder builder) {
		this.statementSeparator = builder.statementSeparator;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Compiles SXL source text.
	 * 
	 * @param source the SXL source
	 * @return the generated code, one statement per top-level form
	 * @throws org.javai.sxlc.sxl.SxlLexException if the source contains an unrecognized character
	 *         or an unterminated string
	 * @throws org.javai.sxlc.sxl.SxlParseException if the tokens do not form valid SXL
	 */
	public String compile(String source) {
		List<SxlToken> tokens = tokenize(source);
		SxlProgram program = parse(tokens);
		TargetProgram target = transform(program);
		return generate(target);
	}

	public List<SxlToken> tokenize(String source) {
		List<SxlToken> tokens = new SxlTokenizer(source).tokenize();
		logger.debug("Tokenized {} character(s) into {} token(s)", source.length(), tokens.size());
		return tokens;
	}

	public SxlProgram parse(List<SxlToken> tokens) {
		SxlProgram program = new SxlParser(tokens).parse();
		logger.debug("Parsed {} top-level form(s)", program.body().size());
		return program;
	}

	/**
	 * Walks a source program with arbitrary enter/exit hooks.
	 */
	public <C> void traverse(SxlProgram program, SxlWalkListener<C> listener, C initialContext) {
		SxlNodeWalker.traverse(program, listener, initialContext);
	}

	public TargetProgram transform(SxlProgram program) {
		return SxlToTargetTransformer.transform(program);
	}

	public String generate(TargetNode node) {
		String code = new CodeGenerator(statementSeparator).render(node);
		logger.debug("Generated {} character(s) of code", code.length());
		return code;
	}

	public String getStatementSeparator() {
		return statementSeparator;
	}

	public static final class Builder {

		private String statementSeparator = CodeGenerator.DEFAULT_STATEMENT_SEPARATOR;

		private Builder() {
		}

		/**
		 * Text placed between the rendered top-level statements. Defaults to a newline.
		 */
		public Builder statementSeparator(String statementSeparator) {
			this.statementSeparator = Objects.requireNonNull(statementSeparator,
					"statementSeparator must not be null");
			return this;
		}

		public SxlCompiler build() {
			return new SxlCompiler(this);
		}
	}
}
