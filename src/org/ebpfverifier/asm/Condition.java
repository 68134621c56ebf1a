package org.ebpfverifier.asm;

/**
 * A comparison between a register and a value, as used by conditional jumps. The plain relational operators compare
 * unsigned, the ones prefixed with S compare signed.
 */
public final class Condition {

	public enum Op {
		EQ("=="), NE("!="), SET("&=="), NSET("&!="), LT("<"), LE("<="), GT(">"), GE(">="), SLT("s<"), SLE("s<="), SGT("s>"), SGE("s>=");

		private final String symbol;

		Op(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		public boolean isUnsigned() {
			return this == LT || this == LE || this == GT || this == GE;
		}
	}

	private final Op op;
	private final Reg left;
	private final Value right;

	public Condition(Op op, Reg left, Value right) {
		assert op != null && left != null && right != null;
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public Op getOp() {
		return op;
	}

	public Reg getLeft() {
		return left;
	}

	public Value getRight() {
		return right;
	}

	/**
	 * @return The condition that holds exactly when this one does not.
	 */
	public Condition negate() {
		final Op neg;
		switch (op) {
			case EQ: neg = Op.NE; break;
			case NE: neg = Op.EQ; break;
			case SET: neg = Op.NSET; break;
			case NSET: neg = Op.SET; break;
			case LT: neg = Op.GE; break;
			case LE: neg = Op.GT; break;
			case GT: neg = Op.LE; break;
			case GE: neg = Op.LT; break;
			case SLT: neg = Op.SGE; break;
			case SLE: neg = Op.SGT; break;
			case SGT: neg = Op.SLE; break;
			case SGE: neg = Op.SLT; break;
			default: throw new AssertionError("unknown operator " + op);
		}
		return new Condition(neg, left, right);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Condition)) {
			return false;
		}
		Condition c = (Condition) o;
		return op == c.op && left.equals(c.left) && right.equals(c.right);
	}

	@Override
	public int hashCode() {
		return op.hashCode() ^ 31 * left.hashCode() ^ right.hashCode();
	}

	@Override
	public String toString() {
		return left + " " + op.getSymbol() + " " + right;
	}
}
