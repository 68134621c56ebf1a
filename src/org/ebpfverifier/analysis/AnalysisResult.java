package org.ebpfverifier.analysis;

import org.ebpfverifier.cfa.Label;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an analysis run: the invariants at the start and end of every block and the obligations which could not
 * be proven.
 *
 * @param <D> The abstract domain.
 */
public final class AnalysisResult<D extends AbstractDomain<D>> {

	private final Map<Label, D> preInvariants;
	private final Map<Label, D> postInvariants;
	private final List<String> diagnostics;
	private final double seconds;

	AnalysisResult(Map<Label, D> preInvariants, Map<Label, D> postInvariants, List<String> diagnostics, double seconds) {
		this.preInvariants = Collections.unmodifiableMap(preInvariants);
		this.postInvariants = Collections.unmodifiableMap(postInvariants);
		this.diagnostics = Collections.unmodifiableList(diagnostics);
		this.seconds = seconds;
	}

	/**
	 * @return True if every obligation of the program was proven.
	 */
	public boolean isPass() {
		return diagnostics.isEmpty();
	}

	public List<String> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return The wall clock time of the analysis in seconds.
	 */
	public double getSeconds() {
		return seconds;
	}

	public Map<Label, D> getPreInvariants() {
		return preInvariants;
	}

	public Map<Label, D> getPostInvariants() {
		return postInvariants;
	}

	/**
	 * @return 1 or 0 for pass or fail, followed by the time in seconds.
	 */
	@Override
	public String toString() {
		return (isPass() ? "1" : "0") + "," + seconds;
	}
}
