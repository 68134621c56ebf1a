package org.ebpfverifier.asm;

/**
 * Unary ALU instruction operating in place on a register.
 */
public final class Un extends Statement {

	public enum Op { NEG, LE16, LE32, LE64, BE16, BE32, BE64 }

	private final Op op;
	private final Reg dst;

	public Un(Op op, Reg dst) {
		assert op != null && dst != null;
		this.op = op;
		this.dst = dst;
	}

	public Op getOp() {
		return op;
	}

	public Reg getDst() {
		return dst;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		if (op == Op.NEG) {
			return dst + " = -" + dst;
		}
		return dst + " = " + op.name().toLowerCase() + " " + dst;
	}
}
