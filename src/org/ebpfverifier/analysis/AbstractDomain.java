package org.ebpfverifier.analysis;

import org.ebpfverifier.asm.Assertion;
import org.ebpfverifier.asm.Statement;

/**
 * Capability of an abstract domain usable by the {@link FixpointIterator}. Elements are immutable, every operation
 * returns a new element.
 *
 * @param <D> The concrete domain type.
 */
public interface AbstractDomain<D extends AbstractDomain<D>> {

	/**
	 * Compute the least upper bound of two elements.
	 *
	 * @param d The other element.
	 * @return Their join.
	 */
	D join(D d);

	/**
	 * Compute the greatest lower bound of two elements.
	 *
	 * @param d The other element.
	 * @return Their meet.
	 */
	D meet(D d);

	/**
	 * Extrapolate from this element to the given one so that every ascending chain stabilizes.
	 *
	 * @param d The newer element.
	 * @return An upper bound of both elements.
	 */
	D widen(D d);

	/**
	 * Refine this element with the given one, replacing only infinite bounds.
	 *
	 * @param d The newer element.
	 * @return The refined element.
	 */
	D narrow(D d);

	boolean lessOrEqual(D d);

	boolean isBot();

	boolean isTop();

	/**
	 * Compute the effect of a statement.
	 *
	 * @param stmt The statement.
	 * @return The post state.
	 */
	D transfer(Statement stmt);

	/**
	 * Check whether every concrete state described by this element satisfies the assertion.
	 *
	 * @param assertion The assertion.
	 * @return True if the assertion provably holds.
	 */
	boolean entails(Assertion assertion);
}
