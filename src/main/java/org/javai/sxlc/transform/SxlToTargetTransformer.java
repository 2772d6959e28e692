package org.javai.sxlc.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.sxlc.sxl.SxlCallExpression;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.sxl.SxlNodeWalker;
import org.javai.sxlc.sxl.SxlNumberLiteral;
import org.javai.sxlc.sxl.SxlProgram;
import org.javai.sxlc.sxl.SxlStringLiteral;
import org.javai.sxlc.sxl.SxlWalkListener;
import org.javai.sxlc.target.TargetCallExpression;
import org.javai.sxlc.target.TargetExpressionStatement;
import org.javai.sxlc.target.TargetIdentifier;
import org.javai.sxlc.target.TargetNode;
import org.javai.sxlc.target.TargetNumberLiteral;
import org.javai.sxlc.target.TargetProgram;
import org.javai.sxlc.target.TargetStringLiteral;

/**
 * Transforms a parsed SXL program into a target-shaped AST in a single
 * depth-first walk.
 * 
 * <p>The walk context is the output sink: the list the current node's
 * translation is appended to. Entering a call opens a fresh argument list
 * and hands it down as the sink for its children; exiting the call builds the
 * target call from the completed list and appends it to the enclosing sink.
 * A call whose source parent is not a call is wrapped in a
 * {@link TargetExpressionStatement}. The source tree is not modified.</p>
 * 
 * <p>Instances hold the open argument lists of the current walk and are used
 * for one transformation only.</p>
 */
public final class SxlToTargetTransformer implements SxlWalkListener<List<TargetNode>> {

	private final Deque<List<TargetNode>> openArguments = new ArrayDeque<>();

	private SxlToTargetTransformer() {
	}

	/**
	 * Builds the target AST for a source program.
	 */
	public static TargetProgram transform(SxlProgram program) {
		Objects.requireNonNull(program, "program must not be null");
		List<TargetNode> body = new ArrayList<>();
		SxlNodeWalker.traverse(program, new SxlToTargetTransformer(), body);
		return new TargetProgram(body);
	}

	@Override
	public void enterNumber(SxlNumberLiteral number, SxlNode parent, List<TargetNode> sink) {
		sink.add(new TargetNumberLiteral(number.value()));
	}

	@Override
	public void enterString(SxlStringLiteral string, SxlNode parent, List<TargetNode> sink) {
		sink.add(new TargetStringLiteral(string.value()));
	}

	@Override
	public List<TargetNode> enterCall(SxlCallExpression call, SxlNode parent, List<TargetNode> sink) {
		List<TargetNode> arguments = new ArrayList<>();
		openArguments.push(arguments);
		return arguments;
	}

	@Override
	public void exitCall(SxlCallExpression call, SxlNode parent, List<TargetNode> sink) {
		TargetNode expression = new TargetCallExpression(new TargetIdentifier(call.name()), openArguments.pop());

		if (!(parent instanceof SxlCallExpression)) {
			expression = new TargetExpressionStatement(expression);
		}

		sink.add(expression);
	}
}
