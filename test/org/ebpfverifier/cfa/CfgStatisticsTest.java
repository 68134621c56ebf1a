package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.Bin;
import org.ebpfverifier.asm.Exit;
import org.ebpfverifier.asm.Imm;
import org.ebpfverifier.asm.Mem;
import org.ebpfverifier.asm.Reg;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CfgStatisticsTest {

	@Test
	public void countsStatementsAndBranches() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock a = cfg.insert(Label.of(0));
		BasicBlock b = cfg.insert(Label.of(1));
		BasicBlock c = cfg.insert(Label.of(2));
		a.insert(new Mem(true, new Reg(0), new Reg(1), 0, 4));
		a.insert(new Bin(Bin.Op.ADD, new Reg(0), new Imm(1L), true));
		b.insert(new Mem(false, new Reg(0), Reg.R10_STACK_POINTER, -8, 8));
		b.insert(new Mem(false, new Imm(3L), Reg.R10_STACK_POINTER, -16, 8));
		c.insert(new Exit());
		cfg.getNode(Label.ENTRY).connect(a);
		a.connect(b);
		a.connect(c);
		b.connect(c);
		c.connect(cfg.getNode(Label.EXIT));

		CfgStatistics stats = CfgStatistics.collect(cfg);
		assertEquals(5, stats.getCount());
		assertEquals(1, stats.getLoads());
		assertEquals(2, stats.getStores());
		assertEquals(1, stats.getJumps());
		assertEquals(1, stats.getJoins());
		assertEquals("5,1,2,1,1", stats.toString());
	}

	@Test
	public void emptyGraph() {
		assertEquals("0,0,0,0,0", CfgStatistics.collect(new ControlFlowGraph()).toString());
	}
}
