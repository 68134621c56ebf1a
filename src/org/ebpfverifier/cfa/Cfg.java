package org.ebpfverifier.cfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The graph interface the fixpoint iterator works on. Implemented by the owning {@link ControlFlowGraph} and by its
 * views {@link CfgRef} and {@link ReverseControlFlowGraph}.
 *
 * @param <B> The type of the blocks.
 */
public interface Cfg<B extends Block> {

	Label entry();

	boolean hasExit();

	/**
	 * @return The exit label. Fails if the graph has no exit.
	 */
	Label exit();

	Collection<Label> nextNodes(Label label);

	Collection<Label> prevNodes(Label label);

	/**
	 * @param label A label of the graph.
	 * @return Its block. Fails if there is none.
	 */
	B getNode(Label label);

	Collection<Label> labels();

	int size();

	/**
	 * Visit every block reachable from the entry once, in depth-first pre-order.
	 *
	 * @param f The action to run per block.
	 */
	default void dfs(Consumer<? super B> f) {
		Set<Label> visited = new HashSet<>();
		Deque<Label> stack = new ArrayDeque<>();
		stack.push(entry());
		while (!stack.isEmpty()) {
			Label cur = stack.pop();
			if (!visited.add(cur)) {
				continue;
			}
			B node = getNode(cur);
			f.accept(node);
			// push in reverse so the first successor is visited first
			List<Label> succs = new ArrayList<>(node.nextBlocks());
			for (int i = succs.size() - 1; i >= 0; i--) {
				if (!visited.contains(succs.get(i))) {
					stack.push(succs.get(i));
				}
			}
		}
	}

	/**
	 * @return All labels reachable from the entry, in depth-first pre-order.
	 */
	default Set<Label> reachableLabels() {
		final Set<Label> result = new LinkedHashSet<>();
		dfs(b -> result.add(b.getLabel()));
		return result;
	}

	/**
	 * Print all blocks reachable from the entry.
	 *
	 * @param sb Where to print to.
	 */
	default void write(final StringBuilder sb) {
		dfs(b -> b.write(sb));
	}
}
