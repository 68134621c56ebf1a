package org.ebpfverifier.asm;

/**
 * One of the eleven eBPF registers r0 to r10.
 */
public final class Reg extends Value {

	public static final int COUNT = 11;

	/**
	 * Read-only frame pointer.
	 */
	public static final Reg R10_STACK_POINTER = new Reg(10);

	private final int index;

	public Reg(int index) {
		if (index < 0 || index >= COUNT) {
			throw new IllegalArgumentException("Invalid register r" + index);
		}
		this.index = index;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public boolean isRegister() {
		return true;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Reg && ((Reg) o).index == index;
	}

	@Override
	public int hashCode() {
		return index;
	}

	@Override
	public String toString() {
		return "r" + index;
	}
}
