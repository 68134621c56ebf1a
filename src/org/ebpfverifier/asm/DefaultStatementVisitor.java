package org.ebpfverifier.asm;

/**
 * Visitor which forwards every statement it does not override to {@link #visitDefault(Statement)}.
 */
public abstract class DefaultStatementVisitor<T> implements StatementVisitor<T> {

	protected abstract T visitDefault(Statement stmt);

	@Override
	public T visit(Bin stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Un stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Assume stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Assert stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Mem stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(IncrementLoopCounter stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Exit stmt) {
		return visitDefault(stmt);
	}
}
