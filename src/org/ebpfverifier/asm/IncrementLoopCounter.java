package org.ebpfverifier.asm;

import org.ebpfverifier.cfa.Label;

/**
 * Counts one more entry into the loop headed by the given label.
 */
public final class IncrementLoopCounter extends Statement {

	private final Label header;

	public IncrementLoopCounter(Label header) {
		assert header != null;
		this.header = header;
	}

	public Label getHeader() {
		return header;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "count(" + header + ")++";
	}
}
