package org.ebpfverifier.analysis.intervals;

import org.ebpfverifier.analysis.AbstractDomain;
import org.ebpfverifier.asm.Assert;
import org.ebpfverifier.asm.Assertion;
import org.ebpfverifier.asm.Assume;
import org.ebpfverifier.asm.Bin;
import org.ebpfverifier.asm.BoundedLoopCount;
import org.ebpfverifier.asm.Condition;
import org.ebpfverifier.asm.Exit;
import org.ebpfverifier.asm.Imm;
import org.ebpfverifier.asm.IncrementLoopCounter;
import org.ebpfverifier.asm.Mem;
import org.ebpfverifier.asm.Reg;
import org.ebpfverifier.asm.Statement;
import org.ebpfverifier.asm.StatementVisitor;
import org.ebpfverifier.asm.Un;
import org.ebpfverifier.asm.ValidCondition;
import org.ebpfverifier.asm.Value;
import org.ebpfverifier.cfa.Label;
import org.ebpfverifier.util.Logger;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

/**
 * Interval valuation of the eBPF registers and of the loop counters. Registers without an entry are unconstrained,
 * loop counters without an entry are zero. Registers hold mathematical integers; results which leave the range of
 * the operation's width are wrapped if they are exact and lose all information otherwise.
 */
public final class IntervalValuationState implements AbstractDomain<IntervalValuationState> {

	private static final Logger logger = Logger.getLogger(IntervalValuationState.class);

	private static final BigInteger TWO_32 = BigInteger.ONE.shiftLeft(32);
	private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);
	private static final Interval UINT32 = Interval.of(Bound.ZERO, Bound.of(TWO_32.subtract(BigInteger.ONE)));
	private static final Interval INT64 = Interval.of(Bound.of(Long.MIN_VALUE), Bound.of(Long.MAX_VALUE));
	private static final Interval ZERO = Interval.of(0L);
	private static final Interval ONE = Interval.of(1L);

	private static final Comparator<Reg> byIndex = Comparator.comparingInt(Reg::getIndex);

	private final boolean bot;
	private final Map<Reg, Interval> registers;
	private final Map<Label, Interval> loopCounters;
	private final Thresholds thresholds;

	private IntervalValuationState(boolean bot, Map<Reg, Interval> registers, Map<Label, Interval> loopCounters, Thresholds thresholds) {
		assert registers != null && loopCounters != null;
		this.bot = bot;
		this.registers = registers;
		this.loopCounters = loopCounters;
		this.thresholds = thresholds;
	}

	static IntervalValuationState mkTop(Thresholds thresholds) {
		return new IntervalValuationState(false, new TreeMap<>(byIndex), new TreeMap<>(), thresholds);
	}

	static IntervalValuationState mkBot(Thresholds thresholds) {
		return new IntervalValuationState(true, new TreeMap<>(byIndex), new TreeMap<>(), thresholds);
	}

	private IntervalValuationState bottom() {
		return mkBot(thresholds);
	}

	private IntervalValuationState copy() {
		Map<Reg, Interval> regs = new TreeMap<>(byIndex);
		regs.putAll(registers);
		return new IntervalValuationState(false, regs, new TreeMap<>(loopCounters), thresholds);
	}

	public Interval getRegister(Reg r) {
		if (bot) {
			return Interval.bottom();
		}
		Interval i = registers.get(r);
		return i == null ? Interval.top() : i;
	}

	public Interval getLoopCounter(Label header) {
		if (bot) {
			return Interval.bottom();
		}
		Interval i = loopCounters.get(header);
		return i == null ? ZERO : i;
	}

	/**
	 * Set a register to a value. Setting bottom makes the whole state bottom.
	 *
	 * @param r The register.
	 * @param value The new value.
	 * @return The new state.
	 */
	public IntervalValuationState setRegister(Reg r, Interval value) {
		if (bot) {
			return this;
		}
		if (value.isBot()) {
			return bottom();
		}
		IntervalValuationState s = copy();
		s.putRegister(r, value);
		return s;
	}

	public IntervalValuationState setLoopCounter(Label header, Interval value) {
		if (bot) {
			return this;
		}
		if (value.isBot()) {
			return bottom();
		}
		IntervalValuationState s = copy();
		s.putLoopCounter(header, value);
		return s;
	}

	// only used on fresh copies
	private void putRegister(Reg r, Interval value) {
		if (value.isTop()) {
			registers.remove(r);
		} else {
			registers.put(r, value);
		}
	}

	private void putLoopCounter(Label header, Interval value) {
		if (value.equals(ZERO)) {
			loopCounters.remove(header);
		} else {
			loopCounters.put(header, value);
		}
	}

	private Set<Reg> registerUnion(IntervalValuationState other) {
		Set<Reg> keys = new HashSet<>(registers.keySet());
		keys.addAll(other.registers.keySet());
		return keys;
	}

	private Set<Label> counterUnion(IntervalValuationState other) {
		Set<Label> keys = new HashSet<>(loopCounters.keySet());
		keys.addAll(other.loopCounters.keySet());
		return keys;
	}

	private interface Combiner {
		Interval apply(Interval a, Interval b);
	}

	// combine pointwise over all keys mentioned by either state, bottom in any component makes the result bottom
	private IntervalValuationState combine(IntervalValuationState other, Combiner c) {
		IntervalValuationState s = mkTop(thresholds);
		for (Reg r : registerUnion(other)) {
			Interval v = c.apply(getRegister(r), other.getRegister(r));
			if (v.isBot()) {
				return bottom();
			}
			s.putRegister(r, v);
		}
		for (Label l : counterUnion(other)) {
			Interval v = c.apply(getLoopCounter(l), other.getLoopCounter(l));
			if (v.isBot()) {
				return bottom();
			}
			s.putLoopCounter(l, v);
		}
		return s;
	}

	@Override
	public IntervalValuationState join(IntervalValuationState other) {
		if (isBot()) {
			return other;
		}
		if (other.isBot()) {
			return this;
		}
		return combine(other, Interval::join);
	}

	@Override
	public IntervalValuationState meet(IntervalValuationState other) {
		if (isBot()) {
			return this;
		}
		if (other.isBot()) {
			return other;
		}
		return combine(other, Interval::meet);
	}

	@Override
	public IntervalValuationState widen(IntervalValuationState other) {
		if (isBot()) {
			return other;
		}
		if (other.isBot()) {
			return this;
		}
		final IntervalValuationState result;
		if (thresholds != null) {
			result = combine(other, (a, b) -> a.widen(b, thresholds));
		} else {
			result = combine(other, Interval::widen);
		}
		logger.debug("Widened " + this + " with " + other + " to " + result);
		return result;
	}

	@Override
	public IntervalValuationState narrow(IntervalValuationState other) {
		if (isBot() || other.isBot()) {
			return bottom();
		}
		return combine(other, Interval::narrow);
	}

	@Override
	public boolean lessOrEqual(IntervalValuationState other) {
		if (isBot()) {
			return true;
		}
		if (other.isBot()) {
			return false;
		}
		for (Reg r : registerUnion(other)) {
			if (!getRegister(r).lessOrEqual(other.getRegister(r))) {
				return false;
			}
		}
		for (Label l : counterUnion(other)) {
			if (!getLoopCounter(l).lessOrEqual(other.getLoopCounter(l))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean isBot() {
		return bot;
	}

	/**
	 * The top state knows nothing about the registers and has not entered any loop yet.
	 */
	@Override
	public boolean isTop() {
		return !bot && registers.isEmpty() && loopCounters.isEmpty();
	}

	@Override
	public IntervalValuationState transfer(Statement stmt) {
		if (bot) {
			return this;
		}
		IntervalValuationState post = stmt.accept(new Transformer());
		if (logger.isDebugEnabled()) {
			logger.debug(stmt + ": " + this + " -> " + post);
		}
		return post;
	}

	/**
	 * Check an assertion. A condition holds if assuming its negation leads to bottom, a loop bound holds if the upper
	 * bound of the counter does not exceed the limit.
	 */
	@Override
	public boolean entails(Assertion assertion) {
		if (bot) {
			return true;
		}
		if (assertion instanceof ValidCondition) {
			Condition cond = ((ValidCondition) assertion).getCondition();
			return assume(cond.negate()).isBot();
		} else if (assertion instanceof BoundedLoopCount) {
			BoundedLoopCount bound = (BoundedLoopCount) assertion;
			return getLoopCounter(bound.getHeader()).getUb().lessOrEqual(Bound.of(bound.getLimit()));
		}
		throw logger.fatalError("Unknown assertion " + assertion);
	}

	private Interval eval(Value v) {
		if (v.isRegister()) {
			return getRegister((Reg) v);
		}
		return Interval.of(((Imm) v).getValue());
	}

	/**
	 * Bring an exact result back into the signed 64 bit range. Non-singleton results which overflow become top.
	 *
	 * @param i The mathematical result.
	 * @return The register value.
	 */
	static Interval wrap64(Interval i) {
		if (i.isBot() || i.isTop() || i.lessOrEqual(INT64)) {
			return i;
		}
		if (i.singleton().isPresent()) {
			return Interval.of(BigInteger.valueOf(i.singleton().get().mod(TWO_64).longValue()));
		}
		return Interval.top();
	}

	/**
	 * Truncate to the low 32 bits, read as unsigned.
	 *
	 * @param i The value.
	 * @return The truncated value.
	 */
	static Interval wrap32(Interval i) {
		if (i.isBot() || i.lessOrEqual(UINT32)) {
			return i;
		}
		if (i.singleton().isPresent()) {
			return Interval.of(i.singleton().get().mod(TWO_32));
		}
		return UINT32;
	}

	private static boolean bothNonNegative(Interval a, Interval b) {
		return a.isNonNegative() && b.isNonNegative();
	}

	IntervalValuationState assume(Condition cond) {
		if (bot) {
			return this;
		}
		Reg left = cond.getLeft();
		Value right = cond.getRight();
		Interval l = getRegister(left);
		Interval r = eval(right);
		Interval newL = l;
		Interval newR = r;
		Condition.Op op = cond.getOp();
		if (right.equals(left)) {
			return assumeSelf(op, left, l);
		}
		if (op.isUnsigned() && !bothNonNegative(l, r)) {
			// the unsigned order agrees with the signed one only on non-negative values
			return this;
		}
		switch (op) {
			case EQ:
				newL = l.meet(r);
				newR = newL;
				break;
			case NE:
				newL = Interval.trim(l, r);
				newR = Interval.trim(r, l);
				break;
			case SET:
				if (l.equals(ZERO) || r.equals(ZERO)
						|| (l.singleton().isPresent() && r.singleton().isPresent() && l.and(r).equals(ZERO))) {
					return bottom();
				}
				break;
			case NSET:
				if (l.singleton().isPresent() && r.singleton().isPresent() && !l.and(r).equals(ZERO)) {
					return bottom();
				}
				break;
			case LT:
			case SLT:
				newL = l.meet(Interval.of(Bound.MINUS_INFINITY, r.getUb().sub(Bound.ONE)));
				newR = r.meet(Interval.of(l.getLb().add(Bound.ONE), Bound.PLUS_INFINITY));
				break;
			case LE:
			case SLE:
				newL = l.meet(r.lowerHalfLine());
				newR = r.meet(l.upperHalfLine());
				break;
			case GT:
			case SGT:
				newL = l.meet(Interval.of(r.getLb().add(Bound.ONE), Bound.PLUS_INFINITY));
				newR = r.meet(Interval.of(Bound.MINUS_INFINITY, l.getUb().sub(Bound.ONE)));
				break;
			case GE:
			case SGE:
				newL = l.meet(r.upperHalfLine());
				newR = r.meet(l.lowerHalfLine());
				break;
			default:
				throw logger.fatalError("Unknown condition " + cond);
		}
		if (newL.isBot() || newR.isBot()) {
			return bottom();
		}
		IntervalValuationState s = copy();
		s.putRegister(left, newL);
		if (right.isRegister()) {
			s.putRegister((Reg) right, newR);
		}
		return s;
	}

	/**
	 * Refine a condition comparing a register with itself. Both sides always hold the same value, so the order
	 * comparisons are decided without looking at the interval.
	 */
	private IntervalValuationState assumeSelf(Condition.Op op, Reg reg, Interval value) {
		switch (op) {
			case EQ:
			case LE:
			case GE:
			case SLE:
			case SGE:
				return this;
			case NE:
			case LT:
			case GT:
			case SLT:
			case SGT:
				return bottom();
			case SET:
				// r & r == r
				return setRegister(reg, Interval.trim(value, ZERO));
			case NSET:
				return setRegister(reg, value.meet(ZERO));
			default:
				throw logger.fatalError("Unknown condition " + op);
		}
	}

	private final class Transformer implements StatementVisitor<IntervalValuationState> {

		@Override
		public IntervalValuationState visit(Bin stmt) {
			Interval src = eval(stmt.getValue());
			Interval dst = getRegister(stmt.getDst());
			if (!stmt.is64()) {
				src = wrap32(src);
				dst = wrap32(dst);
			}
			final Interval result;
			switch (stmt.getOp()) {
				case MOV:
					result = src;
					break;
				case ADD:
					result = dst.add(src);
					break;
				case SUB:
					result = dst.sub(src);
					break;
				case MUL:
					result = dst.mul(src);
					break;
				case UDIV:
					// division by zero yields zero
					if (src.equals(ZERO)) {
						result = ZERO;
					} else if (src.contains(0L)) {
						result = dst.udiv(Interval.trim(src, ZERO)).join(ZERO);
					} else {
						result = dst.udiv(src);
					}
					break;
				case UMOD:
					// modulo zero leaves the dividend unchanged
					if (src.equals(ZERO)) {
						result = dst;
					} else if (src.contains(0L)) {
						result = dst.urem(Interval.trim(src, ZERO)).join(dst);
					} else {
						result = dst.urem(src);
					}
					break;
				case OR:
					result = dst.or(src);
					break;
				case AND:
					result = dst.and(src);
					break;
				case XOR:
					result = dst.xor(src);
					break;
				case LSH:
					result = dst.shl(src);
					break;
				case RSH:
					result = dst.lshr(src);
					break;
				case ARSH:
					if (stmt.is64() || dst.getUb().lessThan(Bound.of(1L << 31))) {
						result = dst.ashr(src);
					} else {
						result = UINT32;
					}
					break;
				default:
					throw logger.fatalError("Unknown operator " + stmt.getOp());
			}
			return setRegister(stmt.getDst(), stmt.is64() ? wrap64(result) : wrap32(result));
		}

		@Override
		public IntervalValuationState visit(Un stmt) {
			if (stmt.getOp() == Un.Op.NEG) {
				return setRegister(stmt.getDst(), wrap64(getRegister(stmt.getDst()).negate()));
			}
			// byte swaps are not tracked
			return setRegister(stmt.getDst(), Interval.top());
		}

		@Override
		public IntervalValuationState visit(Assume stmt) {
			return assume(stmt.getCondition());
		}

		@Override
		public IntervalValuationState visit(Assert stmt) {
			return IntervalValuationState.this;
		}

		@Override
		public IntervalValuationState visit(Mem stmt) {
			if (stmt.isLoad()) {
				return setRegister((Reg) stmt.getValue(), Interval.top());
			}
			return IntervalValuationState.this;
		}

		@Override
		public IntervalValuationState visit(IncrementLoopCounter stmt) {
			return setLoopCounter(stmt.getHeader(), getLoopCounter(stmt.getHeader()).add(ONE));
		}

		@Override
		public IntervalValuationState visit(Exit stmt) {
			return IntervalValuationState.this;
		}
	}

	@Override
	public String toString() {
		if (bot) {
			return "_|_";
		}
		StringBuilder sb = new StringBuilder("{");
		boolean first = true;
		for (Entry<Reg, Interval> e : registers.entrySet()) {
			if (!first) {
				sb.append(", ");
			}
			first = false;
			sb.append(e.getKey()).append(" -> ").append(e.getValue());
		}
		for (Entry<Label, Interval> e : loopCounters.entrySet()) {
			if (!first) {
				sb.append(", ");
			}
			first = false;
			sb.append("count(").append(e.getKey()).append(") -> ").append(e.getValue());
		}
		return sb.append('}').toString();
	}

	@Override
	public int hashCode() {
		return bot ? 0 : registers.hashCode() ^ (31 * loopCounters.hashCode());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		IntervalValuationState other = (IntervalValuationState) obj;
		if (bot || other.bot) {
			return bot == other.bot;
		}
		return registers.equals(other.registers) && loopCounters.equals(other.loopCounters);
	}
}
