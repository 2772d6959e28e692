package org.javai.sxlc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.logging.log4j.Level;
import org.javai.sxlc.sxl.SxlCallExpression;
import org.javai.sxlc.sxl.SxlLexException;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.sxl.SxlParseException;
import org.javai.sxlc.sxl.SxlProgram;
import org.javai.sxlc.sxl.SxlToken;
import org.javai.sxlc.sxl.SxlWalkListener;
import org.javai.sxlc.target.TargetExpressionStatement;
import org.javai.sxlc.target.TargetProgram;
import org.javai.sxlc.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SxlCompilerTest {

	private SxlCompiler compiler;

	@BeforeEach
	void setUp() {
		compiler = new SxlCompiler();
	}

	@Nested
	@DisplayName("compile")
	class Compile {

		@Test
		void nestedCall() {
			assertThat(compiler.compile("(add 2 (subtract 4 3))")).isEqualTo("add(2, subtract(4, 3));");
		}

		@Test
		void flatCall() {
			assertThat(compiler.compile("(cry 10 5)")).isEqualTo("cry(10, 5);");
		}

		@Test
		void zeroArgumentCall() {
			assertThat(compiler.compile("(foo)")).isEqualTo("foo();");
		}

		@Test
		void stringArgumentsKeepTheirQuotesAndContent() {
			assertThat(compiler.compile("(concat \"foo \" \"bar, baz\")"))
				.isEqualTo("concat(\"foo \", \"bar, baz\");");
		}

		@Test
		void oneStatementPerTopLevelForm() {
			String code = compiler.compile("(add 1 2)\n(print \"done\")\n  (exit)");

			assertThat(code.split("\n")).containsExactly("add(1, 2);", "print(\"done\");", "exit();");
		}

		@Test
		void onlyTopLevelCallsEndWithSemicolon() {
			assertThat(compiler.compile("(a (b (c 1) 2) (d))")).isEqualTo("a(b(c(1), 2), d());");
		}

		@Test
		void numberLiteralsArePreservedExactly() {
			assertThat(compiler.compile("(pad 000 0123 99999999999999999999)"))
				.isEqualTo("pad(000, 0123, 99999999999999999999);");
		}

		@Test
		void topLevelLiteralsAreEmittedBare() {
			assertThat(compiler.compile("42 \"x\" (f)")).isEqualTo("42\n\"x\"\nf();");
		}

		@Test
		void emptySourceCompilesToEmptyOutput() {
			assertThat(compiler.compile("  \n ")).isEmpty();
		}

		@Test
		void customStatementSeparator() {
			SxlCompiler oneLine = SxlCompiler.builder()
				.statementSeparator(" ")
				.build();

			assertThat(oneLine.compile("(a) (b 1)")).isEqualTo("a(); b(1);");
			assertThat(oneLine.getStatementSeparator()).isEqualTo(" ");
		}
	}

	@Nested
	@DisplayName("error propagation")
	class Errors {

		@Test
		void lexErrorPropagatesUnchanged() {
			assertThatThrownBy(() -> compiler.compile("(add 1 $)"))
				.isExactlyInstanceOf(SxlLexException.class)
				.isInstanceOf(SxlCompileException.class)
				.hasNoCause()
				.isInstanceOfSatisfying(SxlLexException.class, e -> {
					assertThat(e.getCharacter()).isEqualTo('$');
					assertThat(e.getPosition()).isEqualTo(7);
				});
		}

		@Test
		void unterminatedStringIsALexError() {
			assertThatThrownBy(() -> compiler.compile("(say \"oops)"))
				.isExactlyInstanceOf(SxlLexException.class);
		}

		@Test
		void unclosedParenthesisIsAParseError() {
			assertThatThrownBy(() -> compiler.compile("(add 1 2"))
				.isExactlyInstanceOf(SxlParseException.class)
				.isInstanceOfSatisfying(SxlParseException.class, e -> assertThat(e.isEndOfInput()).isTrue());
		}

		@Test
		void digitLetterAdjacencyIsAParseError() {
			assertThatThrownBy(() -> compiler.compile("(f 1a)"))
				.isExactlyInstanceOf(SxlParseException.class)
				.isInstanceOfSatisfying(SxlParseException.class,
					e -> assertThat(e.getTokenType()).isEqualTo(SxlToken.TokenType.NAME));
		}

		@Test
		void nullSourceIsRejected() {
			assertThatThrownBy(() -> compiler.compile(null))
				.isInstanceOf(NullPointerException.class);
		}
	}

	@Nested
	@DisplayName("individual stages")
	class Stages {

		@Test
		void stagesComposeToCompile() {
			String source = "(add 2 (subtract 4 3))";

			List<SxlToken> tokens = compiler.tokenize(source);
			SxlProgram program = compiler.parse(tokens);
			TargetProgram target = compiler.transform(program);

			assertThat(tokens).hasSize(9);
			assertThat(target.body()).singleElement().isInstanceOf(TargetExpressionStatement.class);
			assertThat(compiler.generate(target)).isEqualTo(compiler.compile(source));
		}

		@Test
		void traverseAcceptsAnyListener() {
			SxlProgram program = compiler.parse(compiler.tokenize("(a (b) (c (d)))"));
			List<String> names = new ArrayList<>();

			compiler.traverse(program, new SxlWalkListener<List<String>>() {
				@Override
				public List<String> enterCall(SxlCallExpression call, SxlNode parent, List<String> sink) {
					sink.add(call.name());
					return sink;
				}
			}, names);

			assertThat(names).containsExactly("a", "b", "c", "d");
		}
	}

	@Test
	void logsStageSummariesAtDebug() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(SxlCompiler.class, Level.DEBUG)) {
			compiler.compile("(cry 10 5)");

			assertThat(captor.messages()).containsExactly(
				"Tokenized 10 character(s) into 5 token(s)",
				"Parsed 1 top-level form(s)",
				"Generated 11 character(s) of code");
			assertThat(captor.levels()).containsOnly(Level.DEBUG);
		}
	}

	@Test
	void concurrentCompilationsAreIndependent() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<String>> results = new ArrayList<>();
			for (int i = 0; i < 32; i++) {
				String source = "(f " + i + " (g \"t\"))";
				Callable<String> task = () -> compiler.compile(source);
				results.add(executor.submit(task));
			}
			for (int i = 0; i < results.size(); i++) {
				assertThat(results.get(i).get()).isEqualTo("f(" + i + ", g(\"t\"));");
			}
		} finally {
			executor.shutdownNow();
		}
	}
}
