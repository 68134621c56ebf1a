package org.ebpfverifier.asm;

public final class Exit extends Statement {

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "exit";
	}
}
