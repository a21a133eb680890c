package io.a2a.lite.server.config;

import java.util.Optional;

/**
 * Source of configuration values for the server components.
 * <p>
 * Implementations decide where values come from (property files, system properties, a framework
 * configuration). Components read their settings once, when they are created.
 */
public interface A2AConfigProvider {

    /**
     * Returns the value of a required property.
     *
     * @param name the property name
     * @return the value
     * @throws IllegalArgumentException if the property is not set
     */
    String getValue(String name);

    /**
     * Returns the value of an optional property.
     *
     * @param name the property name
     * @return the value, empty if not set
     */
    Optional<String> getOptionalValue(String name);

    default int getIntValue(String name) {
        String value = getValue(name);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + name + "' is not an integer: " + value, e);
        }
    }

    default long getLongValue(String name) {
        String value = getValue(name);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + name + "' is not a long: " + value, e);
        }
    }
}
