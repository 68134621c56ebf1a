package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.Statement;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;

/**
 * View of a basic block with its statements in reverse order and predecessors and successors swapped. Nothing is
 * copied, the view reflects the underlying block.
 */
public final class ReverseBasicBlock implements Block {

	private final BasicBlock bb;

	public ReverseBasicBlock(BasicBlock bb) {
		assert bb != null;
		this.bb = bb;
	}

	@Override
	public Label getLabel() {
		return bb.getLabel();
	}

	@Override
	public Iterator<Statement> iterator() {
		List<Statement> statements = bb.getStatements();
		final ListIterator<Statement> it = statements.listIterator(statements.size());
		return new Iterator<Statement>() {
			@Override
			public boolean hasNext() {
				return it.hasPrevious();
			}

			@Override
			public Statement next() {
				return it.previous();
			}
		};
	}

	@Override
	public int size() {
		return bb.size();
	}

	@Override
	public Collection<Label> nextBlocks() {
		return bb.prevBlocks();
	}

	@Override
	public Collection<Label> prevBlocks() {
		return bb.nextBlocks();
	}

	@Override
	public void write(StringBuilder sb) {
		BasicBlock.write(sb, getLabel(), this, nextBlocks());
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		write(sb);
		return sb.toString();
	}
}
