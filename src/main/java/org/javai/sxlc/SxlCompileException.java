package org.javai.sxlc;

/**
 * Root of the exceptions raised while compiling SXL source.
 * Each pipeline stage throws its own subclass; the compiler facade propagates
 * them unchanged.
 */
public abstract class SxlCompileException extends RuntimeException {

	protected SxlCompileException(String message) {
		super(message);
	}
}
