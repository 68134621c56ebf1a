package org.ebpfverifier.cfa;

import java.util.Collection;

/**
 * A cheap, copyable handle to a {@link ControlFlowGraph}. Every operation is forwarded to the graph; the handle must
 * not outlive it.
 */
public final class CfgRef implements Cfg<BasicBlock> {

	private final ControlFlowGraph cfg;

	public CfgRef(ControlFlowGraph cfg) {
		assert cfg != null;
		this.cfg = cfg;
	}

	public ControlFlowGraph get() {
		return cfg;
	}

	@Override
	public Label entry() {
		return cfg.entry();
	}

	@Override
	public boolean hasExit() {
		return cfg.hasExit();
	}

	@Override
	public Label exit() {
		return cfg.exit();
	}

	@Override
	public Collection<Label> nextNodes(Label label) {
		return cfg.nextNodes(label);
	}

	@Override
	public Collection<Label> prevNodes(Label label) {
		return cfg.prevNodes(label);
	}

	@Override
	public BasicBlock getNode(Label label) {
		return cfg.getNode(label);
	}

	@Override
	public Collection<Label> labels() {
		return cfg.labels();
	}

	@Override
	public int size() {
		return cfg.size();
	}

	public void simplify() {
		cfg.simplify();
	}

	public void dump() {
		cfg.dump();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof CfgRef && ((CfgRef) o).cfg == cfg;
	}

	@Override
	public int hashCode() {
		return System.identityHashCode(cfg);
	}

	@Override
	public String toString() {
		return cfg.toString();
	}
}
