package org.ebpfverifier.asm;

public final class Imm extends Value {

	private final long value;

	public Imm(long value) {
		this.value = value;
	}

	public long getValue() {
		return value;
	}

	@Override
	public boolean isRegister() {
		return false;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Imm && ((Imm) o).value == value;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(value);
	}

	@Override
	public String toString() {
		return Long.toString(value);
	}
}
