package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.Statement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A sequence of statements executed top to bottom, with the sets of its predecessor and successor blocks. Blocks are
 * created and owned by a {@link ControlFlowGraph}.
 */
public final class BasicBlock implements Block {

	private final Label label;
	private final List<Statement> statements = new ArrayList<>();
	private final Set<Label> prev = new LinkedHashSet<>();
	private final Set<Label> next = new LinkedHashSet<>();

	BasicBlock(Label label) {
		assert label != null;
		this.label = label;
	}

	@Override
	public Label getLabel() {
		return label;
	}

	/**
	 * Append a statement to the end of the block.
	 *
	 * @param statement The statement.
	 */
	public void insert(Statement statement) {
		assert statement != null;
		statements.add(statement);
	}

	public List<Statement> getStatements() {
		return Collections.unmodifiableList(statements);
	}

	@Override
	public Iterator<Statement> iterator() {
		return getStatements().iterator();
	}

	@Override
	public int size() {
		return statements.size();
	}

	@Override
	public Collection<Label> nextBlocks() {
		return Collections.unmodifiableSet(next);
	}

	@Override
	public Collection<Label> prevBlocks() {
		return Collections.unmodifiableSet(prev);
	}

	/**
	 * Add an edge from this block to b. Adding an existing edge has no effect.
	 *
	 * @param b The target block.
	 */
	public void connect(BasicBlock b) {
		next.add(b.label);
		b.prev.add(label);
	}

	/**
	 * Remove the edge from this block to b, if there is one.
	 *
	 * @param b The target block.
	 */
	public void disconnect(BasicBlock b) {
		next.remove(b.label);
		b.prev.remove(label);
	}

	/**
	 * Move all statements of another block to the end of this one, leaving the other block empty.
	 *
	 * @param other The block to take the statements from.
	 */
	public void moveBack(BasicBlock other) {
		assert other != this;
		statements.addAll(other.statements);
		other.statements.clear();
	}

	// only the owning graph may drop edges one-sided, while removing a neighbour
	void removePrev(Label l) {
		prev.remove(l);
	}

	void removeNext(Label l) {
		next.remove(l);
	}

	@Override
	public void write(StringBuilder sb) {
		write(sb, label, statements, next);
	}

	/**
	 * Render a block as its label, one statement per line and a goto listing the successors.
	 */
	static void write(StringBuilder sb, Label label, Iterable<Statement> statements, Collection<Label> next) {
		sb.append(label).append(":\n");
		for (Statement s : statements) {
			sb.append("  ").append(s).append(";\n");
		}
		if (!next.isEmpty()) {
			sb.append("  goto ");
			Iterator<Label> it = next.iterator();
			while (it.hasNext()) {
				sb.append(it.next());
				sb.append(it.hasNext() ? "," : ";");
			}
		}
		sb.append('\n');
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		write(sb);
		return sb.toString();
	}
}
