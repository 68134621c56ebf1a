package org.ebpfverifier.analysis.intervals;

import org.ebpfverifier.util.Logger;

import java.math.BigInteger;
import java.util.Optional;

/**
 * An integer extended with plus and minus infinity. Infinite bounds only carry a sign, their magnitude is always
 * normalized to 1.
 */
public final class Bound implements Comparable<Bound> {

	private static final Logger logger = Logger.getLogger(Bound.class);

	public static final Bound PLUS_INFINITY = new Bound(true, BigInteger.ONE);
	public static final Bound MINUS_INFINITY = new Bound(true, BigInteger.ONE.negate());
	public static final Bound ZERO = new Bound(false, BigInteger.ZERO);
	public static final Bound ONE = new Bound(false, BigInteger.ONE);

	private final boolean infinite;
	private final BigInteger n;

	private Bound(boolean infinite, BigInteger n) {
		assert n != null;
		this.infinite = infinite;
		if (infinite) {
			this.n = n.signum() > 0 ? BigInteger.ONE : BigInteger.ONE.negate();
		} else {
			this.n = n;
		}
	}

	public static Bound of(long n) {
		return new Bound(false, BigInteger.valueOf(n));
	}

	public static Bound of(BigInteger n) {
		return new Bound(false, n);
	}

	/**
	 * Create an infinite bound with the sign of the given value.
	 *
	 * @param sign Any non-zero number, only its sign is kept.
	 * @return Plus or minus infinity.
	 */
	public static Bound infinity(BigInteger sign) {
		return sign.signum() > 0 ? PLUS_INFINITY : MINUS_INFINITY;
	}

	public static Bound plusInfinity() {
		return PLUS_INFINITY;
	}

	public static Bound minusInfinity() {
		return MINUS_INFINITY;
	}

	public static Bound min(Bound x, Bound y) {
		return x.lessOrEqual(y) ? x : y;
	}

	public static Bound min(Bound x, Bound y, Bound z) {
		return min(x, min(y, z));
	}

	public static Bound min(Bound x, Bound y, Bound z, Bound t) {
		return min(x, min(y, z, t));
	}

	public static Bound max(Bound x, Bound y) {
		return x.lessOrEqual(y) ? y : x;
	}

	public static Bound max(Bound x, Bound y, Bound z) {
		return max(x, max(y, z));
	}

	public static Bound max(Bound x, Bound y, Bound z, Bound t) {
		return max(x, max(y, z, t));
	}

	public boolean isInfinite() {
		return infinite;
	}

	public boolean isFinite() {
		return !infinite;
	}

	public boolean isPlusInfinity() {
		return infinite && n.signum() > 0;
	}

	public boolean isMinusInfinity() {
		return infinite && n.signum() < 0;
	}

	public boolean isZero() {
		return !infinite && n.signum() == 0;
	}

	/**
	 * @return -1, 0 or 1 according to the sign of the bound.
	 */
	public int signum() {
		return n.signum();
	}

	public Bound negate() {
		return new Bound(infinite, n.negate());
	}

	public Bound add(Bound x) {
		if (isFinite() && x.isFinite()) {
			return new Bound(false, n.add(x.n));
		} else if (isFinite()) {
			return x;
		} else if (x.isFinite()) {
			return this;
		} else if (n.equals(x.n)) {
			return this;
		} else {
			throw logger.fatalError("Bound: undefined operation -oo + +oo");
		}
	}

	public Bound sub(Bound x) {
		return add(x.negate());
	}

	public Bound mul(Bound x) {
		if (x.isZero()) {
			return x;
		} else if (isZero()) {
			return this;
		} else {
			return new Bound(infinite || x.infinite, n.multiply(x.n));
		}
	}

	/**
	 * Divide two bounds, rounding towards zero for finite values.
	 *
	 * @param x The divisor, must not be zero.
	 * @return The quotient.
	 */
	public Bound div(Bound x) {
		if (x.isZero()) {
			throw logger.fatalError("Bound: division by zero");
		} else if (isFinite() && x.isFinite()) {
			return new Bound(false, n.divide(x.n));
		} else if (isFinite()) {
			if (n.signum() > 0) {
				return x;
			} else if (n.signum() == 0) {
				return this;
			} else {
				return x.negate();
			}
		} else if (x.isFinite()) {
			return x.n.signum() > 0 ? this : negate();
		} else {
			return new Bound(true, n.multiply(x.n));
		}
	}

	// Exactly one infinite side decides the comparison by its sign alone.
	public boolean lessOrEqual(Bound x) {
		if (infinite ^ x.infinite) {
			if (infinite) {
				return n.signum() < 0;
			}
			return x.n.signum() > 0;
		}
		return n.compareTo(x.n) <= 0;
	}

	public boolean greaterOrEqual(Bound x) {
		if (infinite ^ x.infinite) {
			if (infinite) {
				return n.signum() > 0;
			}
			return x.n.signum() < 0;
		}
		return n.compareTo(x.n) >= 0;
	}

	public boolean lessThan(Bound x) {
		return !greaterOrEqual(x);
	}

	public boolean greaterThan(Bound x) {
		return !lessOrEqual(x);
	}

	public Bound abs() {
		return greaterOrEqual(ZERO) ? this : negate();
	}

	/**
	 * @return The value of a finite bound, nothing for an infinite one.
	 */
	public Optional<BigInteger> number() {
		return infinite ? Optional.<BigInteger>empty() : Optional.of(n);
	}

	/**
	 * Get the value of a finite bound.
	 *
	 * @return The value.
	 */
	public BigInteger getValue() {
		assert isFinite() : "value of infinite bound requested";
		return n;
	}

	@Override
	public int compareTo(Bound o) {
		if (equals(o)) {
			return 0;
		}
		return lessOrEqual(o) ? -1 : 1;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Bound)) {
			return false;
		}
		Bound b = (Bound) o;
		return infinite == b.infinite && n.equals(b.n);
	}

	@Override
	public int hashCode() {
		return (infinite ? 31 : 0) ^ n.hashCode();
	}

	@Override
	public String toString() {
		if (isPlusInfinity()) {
			return "+oo";
		} else if (isMinusInfinity()) {
			return "-oo";
		} else {
			return n.toString();
		}
	}
}
