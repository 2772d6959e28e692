package org.javai.sxlc.target;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Visitor that renders a target AST as C-style call-expression source.
 * 
 * <ul>
 *   <li>program: body entries joined by the statement separator (a newline by default)</li>
 *   <li>expression statement: the expression followed by {@code ;}</li>
 *   <li>call: {@code callee(arg, arg)}</li>
 *   <li>identifiers and numbers: verbatim</li>
 *   <li>strings: wrapped in double quotes, nothing escaped</li>
 * </ul>
 * 
 * Rendering recurses once per nesting level.
 */
public class CodeGenerator implements TargetNodeVisitor<String> {

	public static final String DEFAULT_STATEMENT_SEPARATOR = "\n";

	private final String statementSeparator;

	public CodeGenerator() {
		this(DEFAULT_STATEMENT_SEPARATOR);
	}

	public CodeGenerator(String statementSeparator) {
		this.statementSeparator = Objects.requireNonNull(statementSeparator, "statementSeparator must not be null");
	}

	/**
	 * Render a node with the default statement separator.
	 */
	public static String generate(TargetNode node) {
		return new CodeGenerator().render(node);
	}

	/**
	 * Render a node and all of its descendants.
	 * 
	 * @throws CodeGenerationException if the node, or any node below it, is {@code null}
	 */
	public String render(TargetNode node) {
		if (node == null) {
			throw new CodeGenerationException("Cannot generate code for a null node");
		}
		return node.accept(this);
	}

	@Override
	public String visitProgram(TargetProgram program) {
		return join(program.body(), statementSeparator);
	}

	@Override
	public String visitExpressionStatement(TargetExpressionStatement statement) {
		return render(statement.expression()) + ";";
	}

	@Override
	public String visitCall(TargetCallExpression call) {
		return render(call.callee()) + "(" + join(call.arguments(), ", ") + ")";
	}

	@Override
	public String visitIdentifier(TargetIdentifier identifier) {
		return identifier.name();
	}

	@Override
	public String visitNumber(TargetNumberLiteral number) {
		return number.value();
	}

	@Override
	public String visitString(TargetStringLiteral string) {
		return "\"" + string.value() + "\"";
	}

	private String join(List<TargetNode> nodes, String separator) {
		return nodes.stream()
			.map(this::render)
			.collect(Collectors.joining(separator));
	}
}
