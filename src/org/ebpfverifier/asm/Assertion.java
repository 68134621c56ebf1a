package org.ebpfverifier.asm;

/**
 * A safety obligation that must hold in every state reaching it.
 */
public abstract class Assertion {

	Assertion() {
	}
}
