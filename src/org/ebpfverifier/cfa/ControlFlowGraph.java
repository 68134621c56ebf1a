package org.ebpfverifier.cfa;

import org.ebpfverifier.util.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A control flow graph. The graph owns its blocks; edges are always kept consistent on both ends. Graphs are not
 * copyable: code that needs a cheap handle uses a {@link CfgRef}, backward analyses use a
 * {@link ReverseControlFlowGraph}.
 */
public final class ControlFlowGraph implements Cfg<BasicBlock> {

	private static final Logger logger = Logger.getLogger(ControlFlowGraph.class);

	private final Label entry;
	private Label exit;
	private final Map<Label, BasicBlock> blocks = new TreeMap<>();

	/**
	 * Create a graph with the default entry and exit blocks.
	 */
	public ControlFlowGraph() {
		this(Label.ENTRY, Label.EXIT);
	}

	/**
	 * Create a graph with only an entry block.
	 *
	 * @param entry The entry label.
	 */
	public ControlFlowGraph(Label entry) {
		this.entry = entry;
		this.exit = null;
		blocks.put(entry, new BasicBlock(entry));
	}

	public ControlFlowGraph(Label entry, Label exit) {
		if (entry.equals(exit)) {
			throw logger.fatalError("Entry and exit must be different blocks, got " + entry + " twice");
		}
		this.entry = entry;
		this.exit = exit;
		blocks.put(entry, new BasicBlock(entry));
		blocks.put(exit, new BasicBlock(exit));
	}

	@Override
	public Label entry() {
		return entry;
	}

	@Override
	public boolean hasExit() {
		return exit != null;
	}

	@Override
	public Label exit() {
		if (exit == null) {
			throw logger.fatalError("CFG does not have an exit block");
		}
		return exit;
	}

	/**
	 * Mark an existing block as the exit block after the graph has been created.
	 *
	 * @param label The label of the block.
	 */
	public void setExit(Label label) {
		getNode(label);
		exit = label;
	}

	@Override
	public Collection<Label> nextNodes(Label label) {
		return getNode(label).nextBlocks();
	}

	@Override
	public Collection<Label> prevNodes(Label label) {
		return getNode(label).prevBlocks();
	}

	@Override
	public BasicBlock getNode(Label label) {
		BasicBlock bb = blocks.get(label);
		if (bb == null) {
			throw logger.fatalError("Basic block " + label + " not found in the CFG");
		}
		return bb;
	}

	public boolean contains(Label label) {
		return blocks.containsKey(label);
	}

	/**
	 * Create a new, empty block.
	 *
	 * @param label The label of the block, must not be in use yet.
	 * @return The block.
	 */
	public BasicBlock insert(Label label) {
		if (blocks.containsKey(label)) {
			throw logger.fatalError("Basic block " + label + " already exists in the CFG");
		}
		BasicBlock bb = new BasicBlock(label);
		blocks.put(label, bb);
		return bb;
	}

	/**
	 * Remove a block together with all edges from and to it. The entry and exit blocks cannot be removed.
	 *
	 * @param label The label of the block.
	 */
	public void remove(Label label) {
		if (label.equals(entry)) {
			throw logger.fatalError("Cannot remove the entry block " + label);
		}
		if (label.equals(exit)) {
			throw logger.fatalError("Cannot remove the exit block " + label);
		}
		BasicBlock bb = getNode(label);
		for (Label p : bb.prevBlocks()) {
			if (!p.equals(label)) {
				getNode(p).removeNext(label);
			}
		}
		for (Label n : bb.nextBlocks()) {
			if (!n.equals(label)) {
				getNode(n).removePrev(label);
			}
		}
		blocks.remove(label);
		logger.debug("Removed block " + label);
	}

	@Override
	public Collection<Label> labels() {
		return Collections.unmodifiableSet(blocks.keySet());
	}

	public Collection<BasicBlock> blocks() {
		return Collections.unmodifiableCollection(blocks.values());
	}

	@Override
	public int size() {
		return blocks.size();
	}

	/**
	 * Log all blocks, reachable or not, at debug level.
	 */
	public void dump() {
		logger.debug("Number of basic blocks: " + size());
		for (BasicBlock bb : blocks.values()) {
			logger.debug(bb);
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		write(sb);
		return sb.toString();
	}

	/**
	 * Apply the structural simplifications: merge straight-line blocks, remove blocks not reachable from the entry,
	 * remove blocks from which the exit is not reachable, and merge again twice.
	 */
	public void simplify() {
		int before = size();
		mergeBlocks();
		removeUnreachableBlocks();
		removeUselessBlocks();
		// removing blocks can create new straight-line sequences
		mergeBlocks();
		mergeBlocks();
		logger.verbose("Simplified CFG from " + before + " to " + size() + " blocks");
	}

	private boolean hasOneChild(Label b) {
		return nextNodes(b).size() == 1;
	}

	private boolean hasOneParent(Label b) {
		return prevNodes(b).size() == 1;
	}

	private Label getChild(Label b) {
		assert hasOneChild(b);
		return nextNodes(b).iterator().next();
	}

	private Label getParent(Label b) {
		assert hasOneParent(b);
		return prevNodes(b).iterator().next();
	}

	/**
	 * Merge every block into its predecessor if it is that predecessor's only successor and has no other predecessor.
	 */
	void mergeBlocks() {
		Set<Label> visited = new HashSet<>();
		Deque<Label> stack = new ArrayDeque<>();
		stack.push(entry);
		while (!stack.isEmpty()) {
			Label cur = stack.pop();
			// a label may have been merged away while it was waiting on the stack
			if (!blocks.containsKey(cur) || !visited.add(cur)) {
				continue;
			}
			if (canMergeIntoParent(cur)) {
				BasicBlock parent = getNode(getParent(cur));
				BasicBlock child = getNode(getChild(cur));
				logger.debug("Merging block " + cur + " into " + parent.getLabel());
				parent.moveBack(getNode(cur));
				visited.remove(cur);
				remove(cur);
				parent.connect(child);
				stack.push(child.getLabel());
				continue;
			}
			List<Label> succs = new ArrayList<>(nextNodes(cur));
			for (int i = succs.size() - 1; i >= 0; i--) {
				stack.push(succs.get(i));
			}
		}
	}

	private boolean canMergeIntoParent(Label cur) {
		if (cur.equals(entry) || cur.equals(exit)) {
			return false;
		}
		if (!hasOneChild(cur) || !hasOneParent(cur)) {
			return false;
		}
		Label parent = getParent(cur);
		return !parent.equals(cur) && hasOneChild(parent);
	}

	/**
	 * Remove all blocks which cannot be reached from the entry. The exit block is kept in any case.
	 */
	void removeUnreachableBlocks() {
		Set<Label> alive = markAliveBlocks(entry, true);
		removeAllBut(alive);
	}

	/**
	 * Remove all blocks from which the exit cannot be reached. Does nothing if there is no exit.
	 */
	void removeUselessBlocks() {
		if (!hasExit()) {
			return;
		}
		Set<Label> useful = markAliveBlocks(exit, false);
		removeAllBut(useful);
	}

	private Set<Label> markAliveBlocks(Label start, boolean forward) {
		Set<Label> visited = new HashSet<>();
		Deque<Label> stack = new ArrayDeque<>();
		stack.push(start);
		while (!stack.isEmpty()) {
			Label cur = stack.pop();
			if (!visited.add(cur)) {
				continue;
			}
			for (Label n : forward ? nextNodes(cur) : prevNodes(cur)) {
				stack.push(n);
			}
		}
		return visited;
	}

	private void removeAllBut(Set<Label> keep) {
		List<Label> dead = new ArrayList<>();
		for (Label l : blocks.keySet()) {
			if (!keep.contains(l) && !l.equals(entry) && !l.equals(exit)) {
				dead.add(l);
			}
		}
		for (Label l : dead) {
			remove(l);
		}
	}
}
