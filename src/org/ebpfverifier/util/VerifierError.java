package org.ebpfverifier.util;

/**
 * Thrown when an internal invariant of the analysis engine is violated, e.g. a lookup of a missing block or an
 * undefined operation on bounds. This is never a verification outcome: a program that fails to verify is reported
 * through the analysis result.
 */
public class VerifierError extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public VerifierError(String message) {
		super(message);
	}

	public VerifierError(String message, Throwable cause) {
		super(message, cause);
	}
}
