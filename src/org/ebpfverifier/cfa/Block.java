package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.Statement;

import java.util.Collection;

/**
 * Read access to a basic block, either in program order or reversed.
 */
public interface Block extends Iterable<Statement> {

	Label getLabel();

	/**
	 * @return The labels of the blocks control flows to from this one.
	 */
	Collection<Label> nextBlocks();

	/**
	 * @return The labels of the blocks control flows from into this one.
	 */
	Collection<Label> prevBlocks();

	/**
	 * @return The number of statements.
	 */
	int size();

	void write(StringBuilder sb);
}
