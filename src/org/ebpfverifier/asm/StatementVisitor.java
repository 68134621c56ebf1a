package org.ebpfverifier.asm;

public interface StatementVisitor<T> {

	T visit(Bin stmt);

	T visit(Un stmt);

	T visit(Assume stmt);

	T visit(Assert stmt);

	T visit(Mem stmt);

	T visit(IncrementLoopCounter stmt);

	T visit(Exit stmt);
}
