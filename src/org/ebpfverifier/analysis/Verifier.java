package org.ebpfverifier.analysis;

import org.ebpfverifier.analysis.intervals.IntervalValuationState;
import org.ebpfverifier.analysis.intervals.IntervalValuationStateFactory;
import org.ebpfverifier.analysis.intervals.Thresholds;
import org.ebpfverifier.cfa.Block;
import org.ebpfverifier.cfa.Cfg;
import org.ebpfverifier.cfa.ControlFlowGraph;
import org.ebpfverifier.cfa.Label;
import org.ebpfverifier.util.Logger;

import java.util.Map.Entry;

/**
 * Entry point of the verification: runs the interval analysis over a control flow graph and reports whether all
 * obligations hold.
 */
public final class Verifier {

	private static final Logger logger = Logger.getLogger(Verifier.class);

	private Verifier() {
	}

	/**
	 * Analyze a graph as it is. Nothing is known about the registers at the entry, the context pointer in r1 and the
	 * stack pointer in r10 included.
	 *
	 * @param cfg The graph.
	 * @param options The settings of this run.
	 * @return The result of the analysis.
	 */
	public static <B extends Block> AnalysisResult<IntervalValuationState> runAnalysis(Cfg<B> cfg, VerifierOptions options) {
		logger.verbose("Analyzing " + cfg.size() + " blocks with " + options);
		IntervalValuationStateFactory factory = new IntervalValuationStateFactory(
				options.isWideningThresholds() ? Thresholds.defaultThresholds() : null);
		FixpointIterator<B, IntervalValuationState> iterator = new FixpointIterator<>(cfg, factory, options);
		AnalysisResult<IntervalValuationState> result = iterator.run(factory.top());
		if (options.isPrintInvariants()) {
			printInvariants(result);
		}
		return result;
	}

	public static <B extends Block> AnalysisResult<IntervalValuationState> runAnalysis(Cfg<B> cfg) {
		return runAnalysis(cfg, VerifierOptions.fromGlobalOptions());
	}

	/**
	 * Simplify a graph and analyze it with the settings of the global options.
	 *
	 * @param cfg The graph, simplified in place.
	 * @return The result of the analysis.
	 */
	public static AnalysisResult<IntervalValuationState> validate(ControlFlowGraph cfg) {
		cfg.simplify();
		AnalysisResult<IntervalValuationState> result = runAnalysis(cfg, VerifierOptions.fromGlobalOptions());
		if (result.isPass()) {
			logger.info("Program verified in " + result.getSeconds() + "s");
		} else {
			logger.error("Verification failed: " + result.getDiagnostics().size() + " unproven obligations");
		}
		return result;
	}

	// printed at warn level so the output survives the default verbosity
	private static void printInvariants(AnalysisResult<IntervalValuationState> result) {
		for (Entry<Label, IntervalValuationState> e : result.getPreInvariants().entrySet()) {
			StringBuilder sb = new StringBuilder();
			sb.append(e.getKey()).append(":\n  pre: ").append(e.getValue()).append('\n');
			sb.append("  post: ").append(result.getPostInvariants().get(e.getKey()));
			logger.warn(sb);
		}
	}
}
