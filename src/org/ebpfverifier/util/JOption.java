package org.ebpfverifier.util;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A typed, named option. All options are kept in a global registry so they can be set from an argument list.
 *
 * @param <T> The type of the value: Boolean, Integer, Long or String.
 */
public final class JOption<T> {

	private static final Map<String, JOption<?>> registry = new TreeMap<>();

	private final String name;
	private final String paramName;
	private final T defaultValue;
	private final String description;
	private T value;

	private JOption(String name, String paramName, T defaultValue, String description) {
		assert name != null && !name.isEmpty();
		assert defaultValue != null : "option " + name + " needs a default value";
		this.name = name;
		this.paramName = paramName;
		this.defaultValue = defaultValue;
		this.description = description;
		this.value = defaultValue;
	}

	/**
	 * Create and register a new option.
	 *
	 * @param name The name, used as --name on the command line.
	 * @param paramName Short name of the parameter for help output, empty for flags.
	 * @param defaultValue The default value, also determines the type of the option.
	 * @param description Description for help output.
	 * @return The new option.
	 */
	public static synchronized <T> JOption<T> create(String name, String paramName, T defaultValue, String description) {
		if (registry.containsKey(name)) {
			throw new VerifierError("Option " + name + " registered twice");
		}
		JOption<T> option = new JOption<>(name, paramName, defaultValue, description);
		registry.put(name, option);
		return option;
	}

	public static synchronized JOption<?> lookup(String name) {
		return registry.get(name);
	}

	public static synchronized Collection<JOption<?>> all() {
		return Collections.unmodifiableCollection(registry.values());
	}

	public String getName() {
		return name;
	}

	public T getDefaultValue() {
		return defaultValue;
	}

	public T getValue() {
		return value;
	}

	public void setValue(T value) {
		assert value != null;
		this.value = value;
	}

	public void reset() {
		value = defaultValue;
	}

	public boolean isFlag() {
		return defaultValue instanceof Boolean;
	}

	/**
	 * Set the value from its textual representation.
	 *
	 * @param text The text to parse, according to the type of the default value.
	 */
	@SuppressWarnings("unchecked")
	void parseValue(String text) {
		try {
			if (defaultValue instanceof Boolean) {
				if (!"true".equals(text) && !"false".equals(text)) {
					throw new VerifierError("Invalid value '" + text + "' for option --" + name + ", expected true or false");
				}
				value = (T) Boolean.valueOf(text);
			} else if (defaultValue instanceof Integer) {
				value = (T) Integer.valueOf(text);
			} else if (defaultValue instanceof Long) {
				value = (T) Long.valueOf(text);
			} else {
				value = (T) text;
			}
		} catch (NumberFormatException e) {
			throw new VerifierError("Invalid value '" + text + "' for option --" + name, e);
		}
	}

	@Override
	public String toString() {
		return "--" + name + (isFlag() ? "" : " <" + paramName + ">") + "\t" + description + " (" + value + ")";
	}
}
