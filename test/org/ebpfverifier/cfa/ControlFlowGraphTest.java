package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.Bin;
import org.ebpfverifier.asm.Imm;
import org.ebpfverifier.asm.Reg;
import org.ebpfverifier.asm.Statement;
import org.ebpfverifier.util.VerifierError;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ControlFlowGraphTest {

	private static Statement mov(long v) {
		return new Bin(Bin.Op.MOV, new Reg(0), new Imm(v), true);
	}

	private static void edge(ControlFlowGraph cfg, Label a, Label b) {
		cfg.getNode(a).connect(cfg.getNode(b));
	}

	@Test
	public void newGraphHasEntryAndExit() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		assertEquals(Label.ENTRY, cfg.entry());
		assertTrue(cfg.hasExit());
		assertEquals(Label.EXIT, cfg.exit());
		assertEquals(2, cfg.size());
		ControlFlowGraph noExit = new ControlFlowGraph(Label.of(0));
		assertFalse(noExit.hasExit());
		assertThrows(VerifierError.class, noExit::exit);
		noExit.insert(Label.of(5));
		noExit.setExit(Label.of(5));
		assertEquals(Label.of(5), noExit.exit());
	}

	@Test
	public void misuseIsFatal() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		cfg.insert(Label.of(1));
		assertThrows(VerifierError.class, () -> cfg.getNode(Label.of(2)));
		assertThrows(VerifierError.class, () -> cfg.insert(Label.of(1)));
		assertThrows(VerifierError.class, () -> cfg.remove(Label.ENTRY));
		assertThrows(VerifierError.class, () -> cfg.remove(Label.EXIT));
		assertThrows(VerifierError.class, () -> cfg.remove(Label.of(3)));
		assertThrows(VerifierError.class, () -> cfg.setExit(Label.of(3)));
		assertThrows(VerifierError.class, () -> new ControlFlowGraph(Label.of(1), Label.of(1)));
	}

	@Test
	public void removeDropsEdgesOnBothSides() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		cfg.insert(Label.of(0));
		cfg.insert(Label.of(1));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.of(1));
		edge(cfg, Label.of(1), Label.of(1));
		edge(cfg, Label.of(1), Label.EXIT);
		cfg.remove(Label.of(1));
		assertFalse(cfg.contains(Label.of(1)));
		assertTrue(cfg.nextNodes(Label.of(0)).isEmpty());
		assertTrue(cfg.prevNodes(Label.EXIT).isEmpty());
	}

	@Test
	public void straightLineCollapsesIntoEntry() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		cfg.insert(Label.of(0)).insert(mov(0L));
		cfg.insert(Label.of(1)).insert(mov(1L));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.of(1));
		edge(cfg, Label.of(1), Label.EXIT);
		cfg.simplify();
		assertEquals(2, cfg.size());
		assertEquals(Arrays.asList(mov(0L).toString(), mov(1L).toString()), statementStrings(cfg.getNode(Label.ENTRY)));
		assertEquals(Arrays.asList(Label.EXIT), new ArrayList<>(cfg.nextNodes(Label.ENTRY)));
		assertEquals(Arrays.asList(Label.ENTRY), new ArrayList<>(cfg.prevNodes(Label.EXIT)));
	}

	@Test
	public void simplifyRemovesDeadBlocksAndKeepsBranches() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		for (int i = 0; i < 4; i++) {
			cfg.insert(Label.of(i));
		}
		cfg.insert(Label.of(8));
		cfg.insert(Label.of(9));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.of(1));
		edge(cfg, Label.of(0), Label.of(2));
		edge(cfg, Label.of(0), Label.of(8));
		edge(cfg, Label.of(8), Label.of(8));
		edge(cfg, Label.of(1), Label.of(3));
		edge(cfg, Label.of(2), Label.of(3));
		edge(cfg, Label.of(3), Label.EXIT);
		edge(cfg, Label.of(9), Label.EXIT);
		cfg.simplify();
		assertFalse(cfg.contains(Label.of(8)), "useless block kept");
		assertFalse(cfg.contains(Label.of(9)), "unreachable block kept");
		assertEquals(6, cfg.size());
		assertEquals(2, cfg.nextNodes(Label.of(0)).size());
		assertEquals(2, cfg.prevNodes(Label.of(3)).size());
	}

	@Test
	public void simplifyKeepsExitEvenIfUnreachable() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		cfg.insert(Label.of(0));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.of(0));
		cfg.removeUnreachableBlocks();
		assertTrue(cfg.contains(Label.EXIT));
		cfg.removeUselessBlocks();
		assertTrue(cfg.contains(Label.EXIT));
		assertTrue(cfg.contains(Label.ENTRY));
		assertFalse(cfg.contains(Label.of(0)));
	}

	@Test
	public void simplifyKeepsLiveStatements() {
		for (long seed = 0; seed < 25; seed++) {
			Random random = new Random(seed);
			ControlFlowGraph cfg = new ControlFlowGraph();
			List<Label> labels = new ArrayList<>(Arrays.asList(Label.ENTRY, Label.EXIT));
			for (int i = 0; i < 8; i++) {
				cfg.insert(Label.of(i)).insert(mov(i));
				labels.add(Label.of(i));
			}
			for (int e = 0; e < 14; e++) {
				Label a = labels.get(random.nextInt(labels.size()));
				Label b = labels.get(random.nextInt(labels.size()));
				if (!a.equals(Label.EXIT)) {
					edge(cfg, a, b);
				}
			}
			Set<String> live = new HashSet<>();
			Set<Label> fromEntry = reach(cfg, Label.ENTRY, true);
			Set<Label> toExit = reach(cfg, Label.EXIT, false);
			for (Label l : fromEntry) {
				if (toExit.contains(l)) {
					live.addAll(statementStrings(cfg.getNode(l)));
				}
			}
			cfg.simplify();
			Set<String> after = new HashSet<>();
			Set<Label> fromEntryAfter = reach(cfg, Label.ENTRY, true);
			Set<Label> toExitAfter = reach(cfg, Label.EXIT, false);
			for (Label l : fromEntryAfter) {
				if (toExitAfter.contains(l)) {
					after.addAll(statementStrings(cfg.getNode(l)));
				}
			}
			assertTrue(after.containsAll(live), "seed " + seed + ": lost " + live + " -> " + after);
			checkSymmetric(cfg);
		}
	}

	@Test
	public void dfsVisitsReachableBlocksOnce() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		cfg.insert(Label.of(0));
		cfg.insert(Label.of(1));
		cfg.insert(Label.of(2));
		edge(cfg, Label.ENTRY, Label.of(0));
		edge(cfg, Label.of(0), Label.of(1));
		edge(cfg, Label.of(1), Label.of(0));
		edge(cfg, Label.of(1), Label.EXIT);
		assertEquals(Arrays.asList(Label.ENTRY, Label.of(0), Label.of(1), Label.EXIT), new ArrayList<>(cfg.reachableLabels()));
		String printed = cfg.toString();
		assertTrue(printed.startsWith("entry:\n"));
		assertFalse(printed.contains("2:"));
	}

	@Test
	public void deepChainDoesNotOverflowTheStack() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		Label prev = Label.ENTRY;
		for (int i = 0; i < 100000; i++) {
			cfg.insert(Label.of(i)).insert(mov(i));
			edge(cfg, prev, Label.of(i));
			prev = Label.of(i);
		}
		edge(cfg, prev, Label.EXIT);
		assertEquals(100002, cfg.reachableLabels().size());
		cfg.simplify();
		assertEquals(2, cfg.size());
		assertEquals(100000, cfg.getNode(Label.ENTRY).size());
	}

	private static List<String> statementStrings(Block b) {
		List<String> result = new ArrayList<>();
		for (Statement s : b) {
			result.add(s.toString());
		}
		return result;
	}

	private static Set<Label> reach(ControlFlowGraph cfg, Label start, boolean forward) {
		Set<Label> seen = new HashSet<>();
		Deque<Label> todo = new ArrayDeque<>();
		todo.push(start);
		while (!todo.isEmpty()) {
			Label l = todo.pop();
			if (seen.add(l)) {
				todo.addAll(forward ? cfg.nextNodes(l) : cfg.prevNodes(l));
			}
		}
		return seen;
	}

	private static void checkSymmetric(ControlFlowGraph cfg) {
		for (Label a : cfg.labels()) {
			for (Label b : cfg.nextNodes(a)) {
				assertTrue(cfg.prevNodes(b).contains(a), a + " -> " + b);
			}
			for (Label b : cfg.prevNodes(a)) {
				assertTrue(cfg.nextNodes(b).contains(a), b + " -> " + a);
			}
		}
	}
}
