package io.a2a.lite.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link A2AConfigProvider} reading the defaults shipped in
 * {@value #DEFAULTS_RESOURCE} on the classpath. JVM system properties with the same name take
 * precedence, so any default can be overridden with {@code -Da2a.tasks.processor-threads=8}.
 */
public class DefaultValuesConfigProvider implements A2AConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/a2a-lite-defaults.properties";

    private final Map<String, String> defaults;
    private final Properties overrides;

    public DefaultValuesConfigProvider() {
        this(System.getProperties());
    }

    public DefaultValuesConfigProvider(Properties overrides) {
        this.defaults = loadDefaults();
        this.overrides = overrides;
    }

    private static Map<String, String> loadDefaults() {
        Map<String, String> values = new HashMap<>();
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = DefaultValuesConfigProvider.class.getClassLoader();
        }
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            for (URL url : Collections.list(resources)) {
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String name : properties.stringPropertyNames()) {
                    String value = properties.getProperty(name);
                    String previous = values.putIfAbsent(name, value);
                    if (previous != null && !previous.equals(value)) {
                        LOGGER.warn("Ignoring duplicate default for '{}' in {}: keeping '{}'", name, url, previous);
                    }
                }
                LOGGER.debug("Loaded {} default config values from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value found for: " + name));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String override = overrides.getProperty(name);
        if (override != null) {
            return Optional.of(override);
        }
        return Optional.ofNullable(defaults.get(name));
    }
}
