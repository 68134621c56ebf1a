package org.ebpfverifier.util;

import java.io.PrintStream;

/**
 * Leveled logger of the verifier. The active level is taken from {@link Options#verbosity}, messages go to standard
 * output unless redirected with {@link #setOutput(PrintStream)}.
 */
public class Logger {

	public enum Level { FATAL, ERROR, WARN, INFO, VERBOSE, DEBUG }

	private static final String[] log = new String[5000];
	private static int logNext = 0;
	private static int logSize = 0;

	private static PrintStream out = System.out;

	public static Logger getLogger(Class<?> c) {
		return new Logger(c);
	}

	public static synchronized void setOutput(PrintStream stream) {
		out = stream;
	}

	private final String prefix;

	private Logger(Class<?> clazz) {
		this.prefix = clazz.getSimpleName() + ":\t";
	}

	private static int getLevel() {
		return Options.verbosity.getValue();
	}

	public boolean isDebugEnabled() {
		return Level.DEBUG.ordinal() <= getLevel();
	}

	private static synchronized void logMsg(String msg, boolean doOutput) {
		if (doOutput) {
			out.print(msg);
		}
		if (Options.recordLog.getValue()) {
			log[logNext] = msg;
			logNext = (logNext + 1) % log.length;
			logSize = Math.min(log.length + 1, logSize + 1);
		}
	}

	/**
	 * Print the recorded messages, oldest first, and clear the record.
	 */
	public static synchronized void printLastLog() {
		if (logSize > 0) {
			out.print("*** Last log entries: ***\n");
		}
		if (logSize == log.length + 1) {
			for (int i = 0; i < log.length; i++) {
				out.print(log[(logNext + i) % log.length]);
			}
		} else {
			for (int i = 0; i < logSize; i++) {
				out.print(log[i]);
			}
		}
		clearLastLog();
	}

	public static synchronized void clearLastLog() {
		logSize = 0;
		logNext = 0;
	}

	public void log(Level level, Object message) {
		logMsg(prefix + message + '\n', level.ordinal() <= getLevel());
	}

	public void debug(Object message) {
		log(Level.DEBUG, message);
	}

	public void verbose(Object message) {
		log(Level.VERBOSE, message);
	}

	public void info(Object message) {
		log(Level.INFO, message);
	}

	public void warn(Object message) {
		log(Level.WARN, message);
	}

	public void error(Object message) {
		log(Level.ERROR, message);
	}

	public void fatal(Object message) {
		log(Level.FATAL, message);
	}

	/**
	 * Log a fatal message, dump the recorded log if any and return an error to be thrown by the caller.
	 *
	 * @param message The description of the violated invariant.
	 * @return The error.
	 */
	public VerifierError fatalError(String message) {
		fatal(message);
		printLastLog();
		return new VerifierError(message);
	}
}
