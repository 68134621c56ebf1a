package org.ebpfverifier.asm;

/**
 * Restricts execution to the states in which the condition holds, e.g. on one outgoing edge of a conditional jump.
 */
public final class Assume extends Statement {

	private final Condition cond;

	public Assume(Condition cond) {
		assert cond != null;
		this.cond = cond;
	}

	public Condition getCondition() {
		return cond;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "assume " + cond;
	}
}
