package org.ebpfverifier.asm;

/**
 * An operand of an instruction: either a register or an immediate.
 */
public abstract class Value {

	Value() {
	}

	public abstract boolean isRegister();
}
