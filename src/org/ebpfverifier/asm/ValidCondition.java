package org.ebpfverifier.asm;

/**
 * Obligation that a condition holds for all values the operands can take.
 */
public final class ValidCondition extends Assertion {

	private final Condition cond;

	public ValidCondition(Condition cond) {
		assert cond != null;
		this.cond = cond;
	}

	public Condition getCondition() {
		return cond;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ValidCondition && ((ValidCondition) o).cond.equals(cond);
	}

	@Override
	public int hashCode() {
		return cond.hashCode();
	}

	@Override
	public String toString() {
		return cond.toString();
	}
}
