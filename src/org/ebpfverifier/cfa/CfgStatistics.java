package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.DefaultStatementVisitor;
import org.ebpfverifier.asm.Mem;
import org.ebpfverifier.asm.Statement;

/**
 * Size figures of a control flow graph: number of statements, memory loads and stores, branching blocks and join
 * points.
 */
public final class CfgStatistics {

	private int count;
	private int loads;
	private int stores;
	private int jumps;
	private int joins;

	private CfgStatistics() {
	}

	/**
	 * Collect the statistics of all blocks of a graph, reachable or not.
	 *
	 * @param cfg The graph.
	 * @return The statistics.
	 */
	public static CfgStatistics collect(Cfg<?> cfg) {
		final CfgStatistics stats = new CfgStatistics();
		DefaultStatementVisitor<Void> counter = new DefaultStatementVisitor<Void>() {
			@Override
			protected Void visitDefault(Statement stmt) {
				return null;
			}

			@Override
			public Void visit(Mem stmt) {
				if (stmt.isLoad()) {
					stats.loads++;
				} else {
					stats.stores++;
				}
				return null;
			}
		};
		for (Label l : cfg.labels()) {
			Block bb = cfg.getNode(l);
			for (Statement s : bb) {
				stats.count++;
				s.accept(counter);
			}
			if (bb.nextBlocks().size() > 1) {
				stats.jumps++;
			}
			if (bb.prevBlocks().size() > 1) {
				stats.joins++;
			}
		}
		return stats;
	}

	public int getCount() {
		return count;
	}

	public int getLoads() {
		return loads;
	}

	public int getStores() {
		return stores;
	}

	public int getJumps() {
		return jumps;
	}

	public int getJoins() {
		return joins;
	}

	/**
	 * @return count,loads,stores,jumps,joins
	 */
	@Override
	public String toString() {
		return count + "," + loads + "," + stores + "," + jumps + "," + joins;
	}
}
