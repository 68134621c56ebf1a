package org.ebpfverifier.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Global options of the verifier.
 */
public final class Options {

	public static final JOption<Integer> verbosity = JOption.create("verbosity", "level", Logger.Level.WARN.ordinal(), "Set verbosity to the given level (0 = fatal only, 5 = debug).");
	public static final JOption<Boolean> failFast = JOption.create("fail-fast", "", false, "Stop on the first suspicious situation instead of continuing conservatively.");
	public static final JOption<Boolean> checkTermination = JOption.create("termination", "", false, "Verify that every loop of the program terminates.");
	public static final JOption<Boolean> printInvariants = JOption.create("print-invariants", "", false, "Print the invariants computed for every basic block.");
	public static final JOption<Integer> wideningDelay = JOption.create("widening-delay", "n", 2, "Number of plain joins at a loop head before the analysis starts widening.");
	public static final JOption<Integer> narrowingPasses = JOption.create("narrowing-passes", "n", 2, "Number of descending passes after the fixpoint has been reached.");
	public static final JOption<Long> terminationLimit = JOption.create("termination-limit", "n", 100000L, "Maximum number of iterations allowed for a single loop.");
	public static final JOption<Boolean> recordLog = JOption.create("record-log", "", false, "Record the log and output the last 5000 elements on a fatal error.");
	public static final JOption<Boolean> wideningThresholds = JOption.create("widening-thresholds", "", false, "Widen to the next threshold instead of jumping to infinity.");

	private Options() {
	}

	/**
	 * Parse an argument list and set the options found in it. Options have the form --name value, flags may be given
	 * as --name or --name=true/false.
	 *
	 * @param args The arguments.
	 * @return All arguments which are not options, in their original order.
	 */
	public static List<String> parseOptions(String... args) {
		List<String> rest = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (!arg.startsWith("--")) {
				rest.add(arg);
				continue;
			}
			String name = arg.substring(2);
			String value = null;
			int eq = name.indexOf('=');
			if (eq >= 0) {
				value = name.substring(eq + 1);
				name = name.substring(0, eq);
			}
			JOption<?> option = JOption.lookup(name);
			if (option == null) {
				throw new VerifierError("Unknown option --" + name);
			}
			if (value == null) {
				if (option.isFlag()) {
					value = "true";
				} else if (i + 1 < args.length) {
					value = args[++i];
				} else {
					throw new VerifierError("Missing value for option --" + name);
				}
			}
			option.parseValue(value);
		}
		return rest;
	}

	/**
	 * Reset all registered options to their defaults.
	 */
	public static void resetAll() {
		for (JOption<?> option : JOption.all()) {
			option.reset();
		}
	}

	public static String usage() {
		StringBuilder sb = new StringBuilder();
		for (JOption<?> option : JOption.all()) {
			sb.append("  ").append(option).append('\n');
		}
		return sb.toString();
	}
}
