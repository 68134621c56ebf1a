package org.ebpfverifier.asm;

/**
 * Binary ALU instruction: dst = dst op v, or dst = v for MOV.
 */
public final class Bin extends Statement {

	public enum Op {
		MOV("="), ADD("+="), SUB("-="), MUL("*="), UDIV("/="), UMOD("%="), OR("|="), AND("&="), LSH("<<="), RSH(">>="), ARSH(">>>="), XOR("^=");

		private final String symbol;

		Op(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Op op;
	private final Reg dst;
	private final Value v;
	private final boolean is64;

	public Bin(Op op, Reg dst, Value v, boolean is64) {
		assert op != null && dst != null && v != null;
		this.op = op;
		this.dst = dst;
		this.v = v;
		this.is64 = is64;
	}

	public Op getOp() {
		return op;
	}

	public Reg getDst() {
		return dst;
	}

	public Value getValue() {
		return v;
	}

	public boolean is64() {
		return is64;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return dst + " " + op.getSymbol() + " " + v + (is64 ? "" : " (32)");
	}
}
