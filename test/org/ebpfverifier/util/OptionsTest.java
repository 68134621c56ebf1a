package org.ebpfverifier.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OptionsTest {

	@AfterEach
	public void resetOptions() {
		Options.resetAll();
	}

	@Test
	public void parsesFlagsAndValues() {
		List<String> rest = Options.parseOptions("--termination", "prog.o", "--widening-delay", "5", "--termination-limit=42", "section");
		assertTrue(Options.checkTermination.getValue());
		assertEquals(5, Options.wideningDelay.getValue().intValue());
		assertEquals(42L, Options.terminationLimit.getValue().longValue());
		assertEquals(Arrays.asList("prog.o", "section"), rest);
	}

	@Test
	public void flagCanBeSwitchedOffExplicitly() {
		Options.parseOptions("--termination", "--termination=false");
		assertFalse(Options.checkTermination.getValue());
	}

	@Test
	public void unknownOptionIsRejected() {
		assertThrows(VerifierError.class, () -> Options.parseOptions("--no-such-option"));
	}

	@Test
	public void missingValueIsRejected() {
		assertThrows(VerifierError.class, () -> Options.parseOptions("--verbosity"));
	}

	@Test
	public void badFlagValueIsRejected() {
		assertThrows(VerifierError.class, () -> Options.parseOptions("--termination=yes"));
		assertThrows(VerifierError.class, () -> Options.parseOptions("--fail-fast=True"));
	}

	@Test
	public void badNumberIsRejected() {
		assertThrows(VerifierError.class, () -> Options.parseOptions("--narrowing-passes", "many"));
	}

	@Test
	public void resetRestoresDefaults() {
		Options.wideningDelay.setValue(17);
		Options.resetAll();
		assertEquals(Options.wideningDelay.getDefaultValue(), Options.wideningDelay.getValue());
	}

	@Test
	public void optionsAreRegisteredOnce() {
		assertSame(Options.checkTermination, JOption.lookup("termination"));
		assertThrows(VerifierError.class, () -> JOption.create("termination", "", true, "duplicate"));
	}

	@Test
	public void usageListsEveryOption() {
		String usage = Options.usage();
		for (JOption<?> option : JOption.all()) {
			assertTrue(usage.contains(option.getName()), option.getName());
		}
	}
}
