package org.ebpfverifier.cfa;

/**
 * Identifier of a basic block. Besides the distinguished entry and exit labels, a label names the instruction index
 * the block starts at, or a jump edge from one instruction to another. Labels are ordered entry first, exit last.
 */
public final class Label implements Comparable<Label> {

	private enum Kind { ENTRY, INSTRUCTION, EXIT }

	public static final Label ENTRY = new Label(Kind.ENTRY, -1, -1);
	public static final Label EXIT = new Label(Kind.EXIT, -1, -1);

	private final Kind kind;
	private final int from;
	private final int to;

	private Label(Kind kind, int from, int to) {
		this.kind = kind;
		this.from = from;
		this.to = to;
	}

	/**
	 * @param index An instruction index, non-negative.
	 * @return The label of the block starting at that instruction.
	 */
	public static Label of(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Negative instruction index " + index);
		}
		return new Label(Kind.INSTRUCTION, index, -1);
	}

	/**
	 * @param from The index of a jump instruction.
	 * @param to The index of its target.
	 * @return The label of the block on the jump edge.
	 */
	public static Label of(int from, int to) {
		if (from < 0 || to < 0) {
			throw new IllegalArgumentException("Negative instruction index in " + from + ":" + to);
		}
		return new Label(Kind.INSTRUCTION, from, to);
	}

	public boolean isJump() {
		return kind == Kind.INSTRUCTION && to >= 0;
	}

	@Override
	public int compareTo(Label o) {
		if (kind != o.kind) {
			return kind.compareTo(o.kind);
		}
		if (from != o.from) {
			return Integer.compare(from, o.from);
		}
		return Integer.compare(to, o.to);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Label)) {
			return false;
		}
		Label l = (Label) o;
		return kind == l.kind && from == l.from && to == l.to;
	}

	@Override
	public int hashCode() {
		return kind.ordinal() * 961 + from * 31 + to;
	}

	@Override
	public String toString() {
		switch (kind) {
			case ENTRY:
				return "entry";
			case EXIT:
				return "exit";
			default:
				return to < 0 ? Integer.toString(from) : from + ":" + to;
		}
	}
}
