package org.ebpfverifier.asm;

public final class Assert extends Statement {

	private final Assertion assertion;

	public Assert(Assertion assertion) {
		assert assertion != null;
		this.assertion = assertion;
	}

	public Assertion getAssertion() {
		return assertion;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "assert " + assertion;
	}
}
