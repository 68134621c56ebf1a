package org.ebpfverifier.analysis;

/**
 * Interface for factories of abstract domain elements.
 *
 * @param <D> Thing the factory can produce.
 */
public interface AbstractDomainFactory<D extends AbstractDomain<D>> {

	/**
	 * Create top.
	 *
	 * @return Top.
	 */
	D top();

	/**
	 * Create bot.
	 *
	 * @return Bot.
	 */
	D bot();
}
