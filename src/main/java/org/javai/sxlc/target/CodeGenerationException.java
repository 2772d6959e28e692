package org.javai.sxlc.target;

import org.javai.sxlc.SxlCompileException;

/**
 * Exception thrown when a target AST cannot be rendered.
 */
public class CodeGenerationException extends SxlCompileException {

	public CodeGenerationException(String message) {
		super(message);
	}
}
