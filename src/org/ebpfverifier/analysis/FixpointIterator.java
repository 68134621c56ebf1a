package org.ebpfverifier.analysis;

import org.ebpfverifier.asm.Assert;
import org.ebpfverifier.asm.Assertion;
import org.ebpfverifier.asm.BoundedLoopCount;
import org.ebpfverifier.asm.IncrementLoopCounter;
import org.ebpfverifier.asm.Statement;
import org.ebpfverifier.cfa.Block;
import org.ebpfverifier.cfa.Cfg;
import org.ebpfverifier.cfa.Label;
import org.ebpfverifier.util.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes block invariants of a control flow graph by chaotic iteration in reverse post-order. Loop headers, the
 * targets of back-edges, are widened after a number of plain joins; the stable result is refined by a number of
 * descending passes before the assertions of the program are checked.
 *
 * @param <B> The block type of the graph.
 * @param <D> The abstract domain.
 */
public final class FixpointIterator<B extends Block, D extends AbstractDomain<D>> {

	private static final Logger logger = Logger.getLogger(FixpointIterator.class);

	private final Cfg<B> cfg;
	private final AbstractDomainFactory<D> factory;
	private final VerifierOptions options;

	private final List<Label> rpo = new ArrayList<>();
	private final Map<Label, Integer> rpoIndex = new HashMap<>();
	private final Set<Label> loopHeaders = new LinkedHashSet<>();

	private final Map<Label, D> pre = new HashMap<>();
	private final Map<Label, D> post = new HashMap<>();

	public FixpointIterator(Cfg<B> cfg, AbstractDomainFactory<D> factory, VerifierOptions options) {
		this.cfg = cfg;
		this.factory = factory;
		this.options = options;
		order();
	}

	/**
	 * Compute the reverse post-order of all blocks reachable from the entry and collect the targets of back-edges.
	 */
	private void order() {
		List<Label> postOrder = new ArrayList<>();
		Set<Label> visited = new HashSet<>();
		Set<Label> onStack = new HashSet<>();
		Deque<Label> stack = new ArrayDeque<>();
		Deque<Iterator<Label>> succs = new ArrayDeque<>();
		Label entry = cfg.entry();
		visited.add(entry);
		onStack.add(entry);
		stack.push(entry);
		succs.push(cfg.nextNodes(entry).iterator());
		while (!stack.isEmpty()) {
			Iterator<Label> it = succs.peek();
			if (it.hasNext()) {
				Label next = it.next();
				if (onStack.contains(next)) {
					loopHeaders.add(next);
				} else if (visited.add(next)) {
					onStack.add(next);
					stack.push(next);
					succs.push(cfg.nextNodes(next).iterator());
				}
			} else {
				Label done = stack.pop();
				succs.pop();
				onStack.remove(done);
				postOrder.add(done);
			}
		}
		for (int i = postOrder.size() - 1; i >= 0; i--) {
			rpoIndex.put(postOrder.get(i), rpo.size());
			rpo.add(postOrder.get(i));
		}
		logger.verbose("Found " + rpo.size() + " reachable blocks and " + loopHeaders.size() + " loop headers");
	}

	public List<Label> getReversePostOrder() {
		return Collections.unmodifiableList(rpo);
	}

	public Set<Label> getLoopHeaders() {
		return Collections.unmodifiableSet(loopHeaders);
	}

	/**
	 * The statements executed for a block: the block's own statements, preceded at loop headers by the loop counter
	 * increment and its bound check if termination is checked.
	 */
	private List<Statement> statements(Label l) {
		List<Statement> stmts = new ArrayList<>();
		if (options.isCheckTermination() && loopHeaders.contains(l)) {
			stmts.add(new IncrementLoopCounter(l));
			stmts.add(new Assert(new BoundedLoopCount(l, options.getTerminationLimit())));
		}
		for (Statement s : cfg.getNode(l)) {
			stmts.add(s);
		}
		return stmts;
	}

	private D transferBlock(Label l, D in) {
		D state = in;
		for (Statement s : statements(l)) {
			if (state.isBot()) {
				break;
			}
			state = state.transfer(s);
		}
		return state;
	}

	private D computeIn(Label l, D precondition) {
		D in = l.equals(cfg.entry()) ? precondition : factory.bot();
		for (Label p : cfg.prevNodes(l)) {
			D out = post.get(p);
			if (out != null) {
				in = in.join(out);
			}
		}
		return in;
	}

	/**
	 * Run the analysis.
	 *
	 * @param precondition The state at the start of the entry block.
	 * @return The invariants and the unproven obligations.
	 */
	public AnalysisResult<D> run(D precondition) {
		long start = System.nanoTime();
		pre.clear();
		post.clear();
		ascend(precondition);
		for (int i = 0; i < options.getNarrowingPasses(); i++) {
			descend(precondition);
		}
		List<String> diagnostics = check();
		double seconds = (System.nanoTime() - start) / 1e9;

		Map<Label, D> preInvariants = new TreeMap<>();
		Map<Label, D> postInvariants = new TreeMap<>();
		for (Label l : cfg.labels()) {
			preInvariants.put(l, pre.containsKey(l) ? pre.get(l) : factory.bot());
			postInvariants.put(l, post.containsKey(l) ? post.get(l) : factory.bot());
		}
		logger.info("Analysis of " + rpo.size() + " blocks finished in " + seconds + "s with " + diagnostics.size() + " unproven obligations");
		return new AnalysisResult<>(preInvariants, postInvariants, diagnostics, seconds);
	}

	private void ascend(D precondition) {
		TreeSet<Label> worklist = new TreeSet<>(Comparator.<Label, Integer>comparing(rpoIndex::get));
		Map<Label, Integer> visits = new HashMap<>();
		worklist.add(cfg.entry());
		int iterations = 0;
		while (!worklist.isEmpty()) {
			Label l = worklist.pollFirst();
			iterations++;
			D in = computeIn(l, precondition);
			D old = pre.get(l);
			final D next;
			if (old == null) {
				next = in;
			} else if (loopHeaders.contains(l)) {
				int n = visits.containsKey(l) ? visits.get(l) : 0;
				visits.put(l, n + 1);
				if (n < options.getWideningDelay()) {
					next = old.join(in);
				} else {
					next = old.widen(old.join(in));
				}
			} else {
				next = in;
			}
			if (old != null && next.equals(old)) {
				continue;
			}
			pre.put(l, next);
			D out = transferBlock(l, next);
			D oldOut = post.put(l, out);
			if (oldOut == null || !oldOut.equals(out)) {
				for (Label s : cfg.nextNodes(l)) {
					if (rpoIndex.containsKey(s)) {
						worklist.add(s);
					}
				}
			}
		}
		logger.verbose("Reached fixpoint after " + iterations + " block visits");
	}

	private void descend(D precondition) {
		for (Label l : rpo) {
			D old = pre.get(l);
			if (old == null) {
				continue;
			}
			D in = computeIn(l, precondition);
			D next = loopHeaders.contains(l) ? old.narrow(in) : old.meet(in);
			pre.put(l, next);
			post.put(l, transferBlock(l, next));
		}
		logger.debug("Finished descending pass");
	}

	private List<String> check() {
		List<String> diagnostics = new ArrayList<>();
		for (Label l : rpo) {
			D state = pre.get(l);
			if (state == null) {
				continue;
			}
			int index = 0;
			for (Statement s : statements(l)) {
				if (s instanceof Assert) {
					Assertion a = ((Assert) s).getAssertion();
					if (!state.entails(a)) {
						final String msg;
						if (a instanceof BoundedLoopCount) {
							msg = l + ": could not establish decreasing bound on loop";
						} else {
							msg = l + ":" + index + ": invariant violates obligation " + a;
						}
						logger.warn(msg);
						diagnostics.add(msg);
						if (options.isFailFast()) {
							return diagnostics;
						}
					}
				}
				state = state.transfer(s);
				index++;
			}
		}
		return diagnostics;
	}
}
