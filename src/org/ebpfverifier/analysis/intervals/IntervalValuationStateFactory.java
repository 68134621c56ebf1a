package org.ebpfverifier.analysis.intervals;

import org.ebpfverifier.analysis.AbstractDomainFactory;
import org.ebpfverifier.util.Logger;

public final class IntervalValuationStateFactory implements AbstractDomainFactory<IntervalValuationState> {

	private static final Logger logger = Logger.getLogger(IntervalValuationStateFactory.class);

	private final Thresholds thresholds;

	/**
	 * Create a factory for states which widen straight to infinity.
	 */
	public IntervalValuationStateFactory() {
		this(null);
	}

	/**
	 * @param thresholds The widening thresholds shared by all created states, or null for plain widening.
	 */
	public IntervalValuationStateFactory(Thresholds thresholds) {
		this.thresholds = thresholds;
		if (thresholds != null) {
			logger.verbose("Widening with " + thresholds.size() + " thresholds");
		}
	}

	@Override
	public IntervalValuationState top() {
		return IntervalValuationState.mkTop(thresholds);
	}

	@Override
	public IntervalValuationState bot() {
		return IntervalValuationState.mkBot(thresholds);
	}
}
