package org.ebpfverifier.asm;

/**
 * A decoded instruction, the unit stored in basic blocks. The set of statements is closed; analyses dispatch on it
 * with a {@link StatementVisitor}.
 */
public abstract class Statement {

	Statement() {
	}

	public abstract <T> T accept(StatementVisitor<T> visitor);
}
