package org.ebpfverifier.analysis.intervals;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

public class ThresholdsTest {

	@Test
	public void lookupFindsNeighbours() {
		Thresholds t = Thresholds.of(0L, 10L, 100L);
		assertEquals(Bound.of(10L), t.next(Bound.of(5L)));
		assertEquals(Bound.of(10L), t.next(Bound.of(10L)));
		assertEquals(Bound.plusInfinity(), t.next(Bound.of(101L)));
		assertEquals(Bound.ZERO, t.prev(Bound.of(5L)));
		assertEquals(Bound.minusInfinity(), t.prev(Bound.of(-1L)));
	}

	@Test
	public void defaultsContainPowersOfTwo() {
		Thresholds t = Thresholds.defaultThresholds();
		assertEquals(Bound.of(255L), t.next(Bound.of(200L)));
		assertEquals(Bound.of(256L), t.next(Bound.of(256L)));
		assertEquals(Bound.of(-256L), t.prev(Bound.of(-200L)));
		// 0, 1, -1, three per exponent and the two infinities
		assertEquals(3 + 3 * 32 + 2 - 1, t.size());
		assertNotSame(t, Thresholds.defaultThresholds());
	}

	@Test
	public void widenStopsAtThreshold() {
		Thresholds t = Thresholds.of(0L, 10L, 100L);
		Interval i = Interval.of(0L, 5L).widen(Interval.of(0L, 6L), t);
		assertEquals(Interval.of(0L, 10L), i);
		Interval j = Interval.of(0L, 50L).widen(Interval.of(-3L, 50L), t);
		assertEquals(Interval.of(Bound.minusInfinity(), Bound.of(50L)), j);
	}
}
