package org.ebpfverifier.analysis.intervals;

import java.util.TreeSet;

/**
 * A sorted set of widening thresholds. Widening with thresholds stops at the nearest registered threshold instead of
 * jumping straight to infinity.
 */
public final class Thresholds {

	private final TreeSet<Bound> thresholds = new TreeSet<>();

	public Thresholds() {
		thresholds.add(Bound.MINUS_INFINITY);
		thresholds.add(Bound.PLUS_INFINITY);
	}

	public static Thresholds of(long... values) {
		Thresholds t = new Thresholds();
		for (long v : values) {
			t.add(Bound.of(v));
		}
		return t;
	}

	/**
	 * @return 0, +-1 and the powers of two up to 2^32 with their negations.
	 */
	public static Thresholds defaultThresholds() {
		Thresholds t = of(0L, 1L, -1L);
		for (int i = 1; i <= 32; i++) {
			long p = 1L << i;
			t.add(Bound.of(p));
			t.add(Bound.of(-p));
			t.add(Bound.of(p - 1L));
		}
		return t;
	}

	public void add(Bound b) {
		thresholds.add(b);
	}

	/**
	 * @param b A bound.
	 * @return The greatest threshold less than or equal to b.
	 */
	public Bound prev(Bound b) {
		Bound r = thresholds.floor(b);
		return r == null ? Bound.MINUS_INFINITY : r;
	}

	/**
	 * @param b A bound.
	 * @return The least threshold greater than or equal to b.
	 */
	public Bound next(Bound b) {
		Bound r = thresholds.ceiling(b);
		return r == null ? Bound.PLUS_INFINITY : r;
	}

	public int size() {
		return thresholds.size();
	}

	@Override
	public String toString() {
		return thresholds.toString();
	}
}
