package org.ebpfverifier.analysis.intervals;

import org.ebpfverifier.util.Logger;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Optional;

/**
 * An interval [lb, ub] over the integers extended with infinities. Every interval with lb > ub is the bottom element,
 * (-oo, +oo) is the top element. Intervals are immutable, all operations return new intervals.
 */
public final class Interval {

	private static final Logger logger = Logger.getLogger(Interval.class);

	private static final Interval BOT = new Interval(Bound.ZERO, Bound.of(-1L));
	private static final Interval TOP = new Interval(Bound.MINUS_INFINITY, Bound.PLUS_INFINITY);

	private static final BigInteger MAX_SHIFT = BigInteger.valueOf(63L);

	private final Bound lb;
	private final Bound ub;

	private Interval(Bound lb, Bound ub) {
		// [+oo, +oo] and [-oo, -oo] contain no integer
		if (lb.greaterThan(ub) || lb.isPlusInfinity() || ub.isMinusInfinity()) {
			this.lb = Bound.ZERO;
			this.ub = Bound.of(-1L);
		} else {
			this.lb = lb;
			this.ub = ub;
		}
	}

	public static Interval top() {
		return TOP;
	}

	public static Interval bottom() {
		return BOT;
	}

	public static Interval of(Bound lb, Bound ub) {
		return new Interval(lb, ub);
	}

	/**
	 * Create a singleton interval. An infinite bound does not denote a value, so it yields bottom.
	 *
	 * @param b The only element.
	 * @return [b, b] or bottom.
	 */
	public static Interval of(Bound b) {
		if (b.isInfinite()) {
			return BOT;
		}
		return new Interval(b, b);
	}

	public static Interval of(long n) {
		Bound b = Bound.of(n);
		return new Interval(b, b);
	}

	public static Interval of(BigInteger n) {
		Bound b = Bound.of(n);
		return new Interval(b, b);
	}

	public static Interval of(long lb, long ub) {
		return new Interval(Bound.of(lb), Bound.of(ub));
	}

	public Bound getLb() {
		return lb;
	}

	public Bound getUb() {
		return ub;
	}

	public boolean isBot() {
		return lb.greaterThan(ub);
	}

	public boolean isTop() {
		return lb.isMinusInfinity() && ub.isPlusInfinity();
	}

	/**
	 * @return True if every element of the (non-empty) interval is at least zero.
	 */
	public boolean isNonNegative() {
		return !isBot() && lb.greaterOrEqual(Bound.ZERO);
	}

	public Interval lowerHalfLine() {
		return new Interval(Bound.MINUS_INFINITY, ub);
	}

	public Interval upperHalfLine() {
		return new Interval(lb, Bound.PLUS_INFINITY);
	}

	/**
	 * @return The only element of the interval, if there is exactly one.
	 */
	public Optional<BigInteger> singleton() {
		if (!isBot() && lb.equals(ub)) {
			return lb.number();
		}
		return Optional.empty();
	}

	public boolean contains(long n) {
		return contains(Bound.of(n));
	}

	public boolean contains(Bound b) {
		return !isBot() && lb.lessOrEqual(b) && b.lessOrEqual(ub);
	}

	public boolean lessOrEqual(Interval t) {
		final boolean result;
		if (isBot()) {
			result = true;
		} else if (t.isBot()) {
			result = false;
		} else {
			result = t.lb.lessOrEqual(lb) && ub.lessOrEqual(t.ub);
		}
		logger.debug(this + " <= " + t + ": " + result);
		return result;
	}

	public Interval join(Interval t) {
		final Interval result;
		if (isBot()) {
			result = t;
		} else if (t.isBot()) {
			result = this;
		} else {
			result = new Interval(Bound.min(lb, t.lb), Bound.max(ub, t.ub));
		}
		logger.debug("Joining " + this + " and " + t + " to " + result);
		return result;
	}

	/**
	 * Compute the least upper bound of a set of intervals.
	 *
	 * @param c The intervals.
	 * @return Their join, bottom for an empty collection.
	 */
	public static Interval joins(Collection<Interval> c) {
		Interval result = BOT;
		for (Interval i : c) {
			result = result.join(i);
		}
		return result;
	}

	public Interval meet(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			result = new Interval(Bound.max(lb, t.lb), Bound.min(ub, t.ub));
		}
		logger.debug("Meeting " + this + " and " + t + " to " + result);
		return result;
	}

	/**
	 * Widen this interval with a newer one: every bound that grew jumps to infinity.
	 *
	 * @param t The newer interval.
	 * @return The widened interval.
	 */
	public Interval widen(Interval t) {
		final Interval result;
		if (isBot()) {
			result = t;
		} else if (t.isBot()) {
			result = this;
		} else {
			result = new Interval(t.lb.lessThan(lb) ? Bound.MINUS_INFINITY : lb,
					ub.lessThan(t.ub) ? Bound.PLUS_INFINITY : ub);
		}
		logger.debug(this + " `widen` " + t + " = " + result);
		return result;
	}

	/**
	 * Widen this interval with a newer one, but let a growing bound stop at the nearest threshold.
	 *
	 * @param t The newer interval.
	 * @param ts The thresholds.
	 * @return The widened interval.
	 */
	public Interval widen(Interval t, Thresholds ts) {
		final Interval result;
		if (isBot()) {
			result = t;
		} else if (t.isBot()) {
			result = this;
		} else {
			result = new Interval(t.lb.lessThan(lb) ? ts.prev(t.lb) : lb,
					ub.lessThan(t.ub) ? ts.next(t.ub) : ub);
		}
		logger.debug(this + " `widen` " + t + " with thresholds = " + result);
		return result;
	}

	/**
	 * Narrow this interval with a newer one: only infinite bounds are replaced by finite ones.
	 *
	 * @param t The newer interval.
	 * @return The narrowed interval.
	 */
	public Interval narrow(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			result = new Interval(lb.isInfinite() && t.lb.isFinite() ? t.lb : lb,
					ub.isInfinite() && t.ub.isFinite() ? t.ub : ub);
		}
		logger.debug(this + " `narrow` " + t + " = " + result);
		return result;
	}

	public Interval add(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			result = new Interval(lb.add(t.lb), ub.add(t.ub));
		}
		logger.debug(this + " + " + t + " = " + result);
		return result;
	}

	public Interval sub(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			result = new Interval(lb.sub(t.ub), ub.sub(t.lb));
		}
		logger.debug(this + " - " + t + " = " + result);
		return result;
	}

	public Interval negate() {
		final Interval result;
		if (isBot()) {
			result = BOT;
		} else {
			result = new Interval(ub.negate(), lb.negate());
		}
		logger.debug("-" + this + " = " + result);
		return result;
	}

	public Interval mul(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			// sign changes make the extremes appear at any of the corners
			Bound ll = lb.mul(t.lb);
			Bound lu = lb.mul(t.ub);
			Bound ul = ub.mul(t.lb);
			Bound uu = ub.mul(t.ub);
			result = new Interval(Bound.min(ll, lu, ul, uu), Bound.max(ll, lu, ul, uu));
		}
		logger.debug(this + " * " + t + " = " + result);
		return result;
	}

	/**
	 * Signed division rounding towards zero. Division by an interval that only contains zero is undefined; zero is
	 * removed from any other divisor.
	 *
	 * @param t The divisor.
	 * @return The quotient.
	 */
	public Interval div(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			Optional<BigInteger> d = t.singleton();
			if (d.isPresent() && d.get().signum() == 0) {
				throw logger.fatalError("Interval: division by " + t);
			}
			if (t.contains(Bound.ZERO)) {
				Interval negative = t.meet(new Interval(Bound.MINUS_INFINITY, Bound.of(-1L)));
				Interval positive = t.meet(new Interval(Bound.ONE, Bound.PLUS_INFINITY));
				result = divNonZero(negative).join(divNonZero(positive));
			} else {
				result = divNonZero(t);
			}
		}
		logger.debug(this + " / " + t + " = " + result);
		return result;
	}

	private Interval divNonZero(Interval t) {
		if (isBot() || t.isBot()) {
			return BOT;
		}
		assert !t.contains(Bound.ZERO);
		Bound ll = lb.div(t.lb);
		Bound lu = lb.div(t.ub);
		Bound ul = ub.div(t.lb);
		Bound uu = ub.div(t.ub);
		Interval result = new Interval(Bound.min(ll, lu, ul, uu), Bound.max(ll, lu, ul, uu));
		if (t.lb.isInfinite() || t.ub.isInfinite()) {
			// a finite dividend divided by a large enough divisor is zero
			result = result.join(of(0L));
		}
		return result;
	}

	/**
	 * Unsigned division. Only non-negative operands with a positive divisor give a result better than top.
	 *
	 * @param t The divisor.
	 * @return The quotient.
	 */
	public Interval udiv(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else if (isNonNegative() && t.lb.greaterThan(Bound.ZERO)) {
			Bound low = t.ub.isInfinite() ? Bound.ZERO : lb.div(t.ub);
			result = new Interval(low, ub.div(t.lb));
		} else {
			result = TOP;
		}
		logger.debug(this + " /u " + t + " = " + result);
		return result;
	}

	/**
	 * Signed remainder, the result has the sign of the dividend.
	 *
	 * @param t The divisor.
	 * @return The remainder.
	 */
	public Interval srem(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			Optional<BigInteger> a = singleton();
			Optional<BigInteger> b = t.singleton();
			if (b.isPresent() && b.get().signum() == 0) {
				result = TOP;
			} else if (a.isPresent() && b.isPresent()) {
				result = of(a.get().remainder(b.get()));
			} else {
				Bound m = Bound.max(t.lb.abs(), t.ub.abs());
				if (m.isInfinite()) {
					// |x % y| <= |x|
					result = new Interval(Bound.min(lb, Bound.ZERO), Bound.max(ub, Bound.ZERO));
				} else {
					Bound k = m.sub(Bound.ONE);
					if (lb.greaterOrEqual(Bound.ZERO)) {
						result = new Interval(Bound.ZERO, Bound.min(ub, k));
					} else if (ub.lessOrEqual(Bound.ZERO)) {
						result = new Interval(Bound.max(lb, k.negate()), Bound.ZERO);
					} else {
						result = new Interval(Bound.max(lb, k.negate()), Bound.min(ub, k));
					}
				}
			}
		}
		logger.debug(this + " %s " + t + " = " + result);
		return result;
	}

	public Interval urem(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else if (isNonNegative() && t.isNonNegative() && t.ub.greaterThan(Bound.ZERO)) {
			if (t.lb.greaterThan(Bound.ZERO) && ub.lessThan(t.lb)) {
				result = this;
			} else {
				Bound k = t.ub.isInfinite() ? ub : Bound.min(ub, t.ub.sub(Bound.ONE));
				result = new Interval(Bound.ZERO, k);
			}
		} else {
			result = TOP;
		}
		logger.debug(this + " %u " + t + " = " + result);
		return result;
	}

	public Interval and(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else if (singleton().isPresent() && t.singleton().isPresent()) {
			result = of(singleton().get().and(t.singleton().get()));
		} else if (isNonNegative() && t.isNonNegative()) {
			result = new Interval(Bound.ZERO, Bound.min(ub, t.ub));
		} else if (isNonNegative()) {
			result = new Interval(Bound.ZERO, ub);
		} else if (t.isNonNegative()) {
			result = new Interval(Bound.ZERO, t.ub);
		} else {
			result = TOP;
		}
		logger.debug(this + " & " + t + " = " + result);
		return result;
	}

	public Interval or(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else if (singleton().isPresent() && t.singleton().isPresent()) {
			result = of(singleton().get().or(t.singleton().get()));
		} else if (isNonNegative() && t.isNonNegative() && ub.isFinite() && t.ub.isFinite()) {
			result = new Interval(Bound.max(lb, t.lb), allOnesAbove(Bound.max(ub, t.ub)));
		} else {
			result = TOP;
		}
		logger.debug(this + " | " + t + " = " + result);
		return result;
	}

	public Interval xor(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else if (singleton().isPresent() && t.singleton().isPresent()) {
			result = of(singleton().get().xor(t.singleton().get()));
		} else if (isNonNegative() && t.isNonNegative() && ub.isFinite() && t.ub.isFinite()) {
			result = new Interval(Bound.ZERO, allOnesAbove(Bound.max(ub, t.ub)));
		} else {
			result = TOP;
		}
		logger.debug(this + " ^ " + t + " = " + result);
		return result;
	}

	/**
	 * @param b A finite, non-negative bound.
	 * @return The smallest 2^k - 1 which is at least b.
	 */
	private static Bound allOnesAbove(Bound b) {
		int bits = b.getValue().bitLength();
		return Bound.of(BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE));
	}

	private static Optional<Integer> shiftAmount(Interval t) {
		Optional<BigInteger> k = t.singleton();
		if (k.isPresent() && k.get().signum() >= 0 && k.get().compareTo(MAX_SHIFT) <= 0) {
			return Optional.of(k.get().intValue());
		}
		return Optional.empty();
	}

	public Interval shl(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			Optional<Integer> k = shiftAmount(t);
			if (k.isPresent()) {
				result = mul(of(BigInteger.ONE.shiftLeft(k.get())));
			} else {
				result = TOP;
			}
		}
		logger.debug(this + " << " + t + " = " + result);
		return result;
	}

	public Interval lshr(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else if (isNonNegative()) {
			Optional<Integer> k = shiftAmount(t);
			if (k.isPresent()) {
				result = new Interval(shiftRight(lb, k.get()), shiftRight(ub, k.get()));
			} else if (t.isNonNegative()) {
				result = new Interval(Bound.ZERO, ub);
			} else {
				result = TOP;
			}
		} else {
			result = TOP;
		}
		logger.debug(this + " >> " + t + " = " + result);
		return result;
	}

	public Interval ashr(Interval t) {
		final Interval result;
		if (isBot() || t.isBot()) {
			result = BOT;
		} else {
			Optional<Integer> k = shiftAmount(t);
			if (k.isPresent()) {
				result = new Interval(shiftRight(lb, k.get()), shiftRight(ub, k.get()));
			} else if (t.isNonNegative()) {
				// x >> k moves towards 0 for x >= 0 and towards -1 for x < 0
				result = new Interval(lb.greaterOrEqual(Bound.ZERO) ? Bound.ZERO : lb,
						ub.greaterOrEqual(Bound.ZERO) ? ub : Bound.of(-1L));
			} else {
				result = TOP;
			}
		}
		logger.debug(this + " >>> " + t + " = " + result);
		return result;
	}

	private static Bound shiftRight(Bound b, int k) {
		if (b.isInfinite()) {
			return b;
		}
		return Bound.of(b.getValue().shiftRight(k));
	}

	/**
	 * Shrink an interval by a value known not to be in it. This only changes something if the value is one of the
	 * endpoints.
	 *
	 * @param i The interval.
	 * @param hole A singleton interval holding the excluded value.
	 * @return The sharpened interval.
	 */
	public static Interval trim(Interval i, Interval hole) {
		Optional<BigInteger> c = hole.singleton();
		if (c.isPresent()) {
			Bound b = Bound.of(c.get());
			if (i.lb.equals(b)) {
				return new Interval(b.add(Bound.ONE), i.ub);
			} else if (i.ub.equals(b)) {
				return new Interval(i.lb, b.sub(Bound.ONE));
			}
		}
		return i;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Interval)) {
			return false;
		}
		Interval t = (Interval) o;
		if (isBot()) {
			return t.isBot();
		}
		return lb.equals(t.lb) && ub.equals(t.ub);
	}

	@Override
	public int hashCode() {
		return isBot() ? 0 : 31 * lb.hashCode() + ub.hashCode();
	}

	@Override
	public String toString() {
		if (isBot()) {
			return "_|_";
		}
		return "[" + lb + ", " + ub + "]";
	}
}
