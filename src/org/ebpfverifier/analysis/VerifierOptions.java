package org.ebpfverifier.analysis;

import org.ebpfverifier.util.Options;

/**
 * Settings of a single analysis run.
 */
public final class VerifierOptions {

	private boolean checkTermination;
	private long terminationLimit;
	private int wideningDelay;
	private int narrowingPasses;
	private boolean printInvariants;
	private boolean failFast;
	private boolean wideningThresholds;

	public VerifierOptions() {
		this.checkTermination = false;
		this.terminationLimit = Options.terminationLimit.getDefaultValue();
		this.wideningDelay = Options.wideningDelay.getDefaultValue();
		this.narrowingPasses = Options.narrowingPasses.getDefaultValue();
		this.printInvariants = false;
		this.failFast = false;
		this.wideningThresholds = false;
	}

	/**
	 * @return The settings given by the current values of the global options.
	 */
	public static VerifierOptions fromGlobalOptions() {
		return new VerifierOptions()
				.setCheckTermination(Options.checkTermination.getValue())
				.setTerminationLimit(Options.terminationLimit.getValue())
				.setWideningDelay(Options.wideningDelay.getValue())
				.setNarrowingPasses(Options.narrowingPasses.getValue())
				.setPrintInvariants(Options.printInvariants.getValue())
				.setFailFast(Options.failFast.getValue())
				.setWideningThresholds(Options.wideningThresholds.getValue());
	}

	public boolean isCheckTermination() {
		return checkTermination;
	}

	public VerifierOptions setCheckTermination(boolean checkTermination) {
		this.checkTermination = checkTermination;
		return this;
	}

	public long getTerminationLimit() {
		return terminationLimit;
	}

	public VerifierOptions setTerminationLimit(long terminationLimit) {
		assert terminationLimit >= 0;
		this.terminationLimit = terminationLimit;
		return this;
	}

	public int getWideningDelay() {
		return wideningDelay;
	}

	public VerifierOptions setWideningDelay(int wideningDelay) {
		assert wideningDelay >= 0;
		this.wideningDelay = wideningDelay;
		return this;
	}

	public int getNarrowingPasses() {
		return narrowingPasses;
	}

	public VerifierOptions setNarrowingPasses(int narrowingPasses) {
		assert narrowingPasses >= 0;
		this.narrowingPasses = narrowingPasses;
		return this;
	}

	public boolean isPrintInvariants() {
		return printInvariants;
	}

	public VerifierOptions setPrintInvariants(boolean printInvariants) {
		this.printInvariants = printInvariants;
		return this;
	}

	public boolean isFailFast() {
		return failFast;
	}

	public VerifierOptions setFailFast(boolean failFast) {
		this.failFast = failFast;
		return this;
	}

	public boolean isWideningThresholds() {
		return wideningThresholds;
	}

	public VerifierOptions setWideningThresholds(boolean wideningThresholds) {
		this.wideningThresholds = wideningThresholds;
		return this;
	}

	@Override
	public String toString() {
		return "termination=" + checkTermination + " limit=" + terminationLimit + " delay=" + wideningDelay
				+ " narrowing=" + narrowingPasses + " thresholds=" + wideningThresholds;
	}
}
