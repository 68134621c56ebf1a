package org.ebpfverifier.asm;

/**
 * A load from or a store to memory at base + offset.
 */
public final class Mem extends Statement {

	private final boolean isLoad;
	private final Value value;
	private final Reg base;
	private final int offset;
	private final int width;

	/**
	 * @param isLoad True for a load into value, false for a store of value.
	 * @param value The loaded register or the stored register/immediate.
	 * @param base The base address register.
	 * @param offset The offset from the base.
	 * @param width The access width in bytes: 1, 2, 4 or 8.
	 */
	public Mem(boolean isLoad, Value value, Reg base, int offset, int width) {
		assert value != null && base != null;
		if (isLoad && !value.isRegister()) {
			throw new IllegalArgumentException("Cannot load into immediate " + value);
		}
		if (width != 1 && width != 2 && width != 4 && width != 8) {
			throw new IllegalArgumentException("Invalid access width " + width);
		}
		this.isLoad = isLoad;
		this.value = value;
		this.base = base;
		this.offset = offset;
		this.width = width;
	}

	public boolean isLoad() {
		return isLoad;
	}

	public Value getValue() {
		return value;
	}

	public Reg getBase() {
		return base;
	}

	public int getOffset() {
		return offset;
	}

	public int getWidth() {
		return width;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		String access = "*(u" + width * 8 + " *)(" + base + (offset < 0 ? " - " + -offset : " + " + offset) + ")";
		return isLoad ? value + " = " + access : access + " = " + value;
	}
}
