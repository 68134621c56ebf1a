package org.ebpfverifier.analysis;

import org.ebpfverifier.analysis.intervals.Bound;
import org.ebpfverifier.analysis.intervals.Interval;
import org.ebpfverifier.analysis.intervals.IntervalValuationState;
import org.ebpfverifier.analysis.intervals.IntervalValuationStateFactory;
import org.ebpfverifier.asm.Assert;
import org.ebpfverifier.asm.Assume;
import org.ebpfverifier.asm.Bin;
import org.ebpfverifier.asm.Condition;
import org.ebpfverifier.asm.Imm;
import org.ebpfverifier.asm.Reg;
import org.ebpfverifier.asm.ValidCondition;
import org.ebpfverifier.cfa.BasicBlock;
import org.ebpfverifier.cfa.ControlFlowGraph;
import org.ebpfverifier.cfa.Label;
import org.ebpfverifier.cfa.ReverseBasicBlock;
import org.ebpfverifier.cfa.ReverseControlFlowGraph;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FixpointIteratorTest {

	private static final Reg R0 = new Reg(0);

	private final IntervalValuationStateFactory factory = new IntervalValuationStateFactory();

	private static Bin mov(long v) {
		return new Bin(Bin.Op.MOV, R0, new Imm(v), true);
	}

	private static Bin add(long v) {
		return new Bin(Bin.Op.ADD, R0, new Imm(v), true);
	}

	private static Assume assume(Condition.Op op, long v) {
		return new Assume(new Condition(op, R0, new Imm(v)));
	}

	private static Assert check(Condition.Op op, long v) {
		return new Assert(new ValidCondition(new Condition(op, R0, new Imm(v))));
	}

	private static void edge(ControlFlowGraph cfg, Label a, Label b) {
		cfg.getNode(a).connect(cfg.getNode(b));
	}

	/**
	 * r0 = 0; while (r0 < 10) r0 += 1;
	 */
	private static ControlFlowGraph countingLoop() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		cfg.insert(Label.of(0)).insert(mov(0L));
		cfg.insert(Label.of(1));
		BasicBlock body = cfg.insert(Label.of(2));
		body.insert(assume(Condition.Op.SLT, 10L));
		body.insert(add(1L));
		cfg.insert(Label.of(3)).insert(assume(Condition.Op.SGE, 10L));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.of(1));
		edge(cfg, Label.of(1), Label.of(2));
		edge(cfg, Label.of(2), Label.of(1));
		edge(cfg, Label.of(1), Label.of(3));
		edge(cfg, Label.of(3), Label.EXIT);
		return cfg;
	}

	@Test
	public void ordersBlocksAndFindsLoopHeaders() {
		FixpointIterator<BasicBlock, IntervalValuationState> it = new FixpointIterator<>(countingLoop(), factory, new VerifierOptions());
		assertEquals(Arrays.asList(Label.ENTRY, Label.of(0), Label.of(1), Label.of(3), Label.EXIT, Label.of(2)), it.getReversePostOrder());
		assertEquals(Collections.singleton(Label.of(1)), it.getLoopHeaders());
	}

	@Test
	public void narrowingRecoversLoopBound() {
		ControlFlowGraph cfg = countingLoop();
		AnalysisResult<IntervalValuationState> result = new FixpointIterator<>(cfg, factory, new VerifierOptions()).run(factory.top());
		assertTrue(result.isPass());
		assertEquals(Interval.of(0L, 10L), result.getPreInvariants().get(Label.of(1)).getRegister(R0));
		assertEquals(Interval.of(10L), result.getPreInvariants().get(Label.EXIT).getRegister(R0));
		assertEquals(Interval.of(1L, 10L), result.getPostInvariants().get(Label.of(2)).getRegister(R0));
	}

	@Test
	public void withoutNarrowingTheBoundStaysOpen() {
		ControlFlowGraph cfg = countingLoop();
		VerifierOptions options = new VerifierOptions().setNarrowingPasses(0);
		AnalysisResult<IntervalValuationState> result = new FixpointIterator<>(cfg, factory, options).run(factory.top());
		assertEquals(Interval.of(Bound.ZERO, Bound.plusInfinity()), result.getPreInvariants().get(Label.of(1)).getRegister(R0));
	}

	@Test
	public void failedAssertionIsReported() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock b = cfg.insert(Label.of(0));
		b.insert(mov(7L));
		b.insert(check(Condition.Op.SLT, 8L));
		b.insert(check(Condition.Op.SLT, 5L));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.EXIT);
		AnalysisResult<IntervalValuationState> result = new FixpointIterator<>(cfg, factory, new VerifierOptions()).run(factory.top());
		assertFalse(result.isPass());
		assertEquals(Collections.singletonList("0:2: invariant violates obligation r0 s< 5"), result.getDiagnostics());
		assertTrue(result.toString().startsWith("0,"));
	}

	@Test
	public void failFastStopsAtFirstViolation() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock b = cfg.insert(Label.of(0));
		b.insert(mov(7L));
		b.insert(check(Condition.Op.EQ, 8L));
		b.insert(check(Condition.Op.EQ, 9L));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.EXIT);
		AnalysisResult<IntervalValuationState> all = new FixpointIterator<>(cfg, factory, new VerifierOptions()).run(factory.top());
		assertEquals(2, all.getDiagnostics().size());
		AnalysisResult<IntervalValuationState> first = new FixpointIterator<>(cfg, factory, new VerifierOptions().setFailFast(true)).run(factory.top());
		assertEquals(1, first.getDiagnostics().size());
	}

	@Test
	public void deadCodeIsNotChecked() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock guard = cfg.insert(Label.of(0));
		guard.insert(mov(3L));
		guard.insert(assume(Condition.Op.SGT, 5L));
		guard.insert(check(Condition.Op.EQ, 100L));
		cfg.insert(Label.of(9)).insert(check(Condition.Op.EQ, 100L));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.EXIT);
		AnalysisResult<IntervalValuationState> result = new FixpointIterator<>(cfg, factory, new VerifierOptions()).run(factory.top());
		assertTrue(result.isPass());
		assertTrue(result.getPostInvariants().get(Label.of(0)).isBot());
		assertTrue(result.getPreInvariants().get(Label.of(9)).isBot());
		assertTrue(result.getPreInvariants().get(Label.EXIT).isBot());
	}

	@Test
	public void runsOnReversedGraph() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock b = cfg.insert(Label.of(0));
		// executed bottom to top in the reversed graph
		b.insert(check(Condition.Op.EQ, 4L));
		b.insert(mov(4L));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.EXIT);
		ReverseControlFlowGraph rev = new ReverseControlFlowGraph(cfg);
		AnalysisResult<IntervalValuationState> result = new FixpointIterator<ReverseBasicBlock, IntervalValuationState>(rev, factory, new VerifierOptions()).run(factory.top());
		assertTrue(result.isPass());
		assertEquals(Interval.of(4L), result.getPreInvariants().get(Label.ENTRY).getRegister(R0));
	}
}
