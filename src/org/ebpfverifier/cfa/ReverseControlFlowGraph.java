package org.ebpfverifier.cfa;

import org.ebpfverifier.util.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * View of a {@link ControlFlowGraph} with all edges and statement sequences reversed, for backward analyses. The
 * entry of the view is the exit of the graph and vice versa. The view wraps the blocks present when it is created.
 */
public final class ReverseControlFlowGraph implements Cfg<ReverseBasicBlock> {

	private static final Logger logger = Logger.getLogger(ReverseControlFlowGraph.class);

	private final ControlFlowGraph cfg;
	private final Map<Label, ReverseBasicBlock> revBlocks = new HashMap<>();

	public ReverseControlFlowGraph(ControlFlowGraph cfg) {
		assert cfg != null;
		this.cfg = cfg;
		for (BasicBlock bb : cfg.blocks()) {
			revBlocks.put(bb.getLabel(), new ReverseBasicBlock(bb));
		}
	}

	@Override
	public Label entry() {
		if (!cfg.hasExit()) {
			throw logger.fatalError("Reversed CFG has no entry: the CFG has no exit block");
		}
		return cfg.exit();
	}

	@Override
	public boolean hasExit() {
		return true;
	}

	@Override
	public Label exit() {
		return cfg.entry();
	}

	@Override
	public Collection<Label> nextNodes(Label label) {
		return cfg.prevNodes(label);
	}

	@Override
	public Collection<Label> prevNodes(Label label) {
		return cfg.nextNodes(label);
	}

	@Override
	public ReverseBasicBlock getNode(Label label) {
		ReverseBasicBlock bb = revBlocks.get(label);
		if (bb == null) {
			throw logger.fatalError("Basic block " + label + " not found in the reversed CFG");
		}
		return bb;
	}

	@Override
	public Collection<Label> labels() {
		return Collections.unmodifiableSet(revBlocks.keySet());
	}

	@Override
	public int size() {
		return revBlocks.size();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		write(sb);
		return sb.toString();
	}
}
