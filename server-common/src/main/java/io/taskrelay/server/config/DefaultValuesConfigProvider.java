package io.taskrelay.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link A2AConfigProvider} backed by every {@code META-INF/a2a-defaults.properties} on the
 * classpath, with JVM system properties taking precedence.
 * <p>
 * Each module ships its defaults in its own file. Two files defining the same key is a
 * packaging error and fails construction.
 */
@ApplicationScoped
public class DefaultValuesConfigProvider implements A2AConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/a2a-defaults.properties";

    private final Map<String, String> defaults;

    public DefaultValuesConfigProvider() {
        this(DefaultValuesConfigProvider.class.getClassLoader());
    }

    DefaultValuesConfigProvider(ClassLoader classLoader) {
        this.defaults = Collections.unmodifiableMap(loadDefaults(classLoader));
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value found for " + name));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String override = System.getProperty(name);
        if (override != null) {
            return Optional.of(override);
        }
        return Optional.ofNullable(defaults.get(name));
    }

    private static Map<String, String> loadDefaults(ClassLoader classLoader) {
        Map<String, String> values = new HashMap<>();
        Map<String, URL> origins = new HashMap<>();
        try {
            for (URL url : Collections.list(classLoader.getResources(DEFAULTS_RESOURCE))) {
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String key : properties.stringPropertyNames()) {
                    URL previous = origins.putIfAbsent(key, url);
                    if (previous != null) {
                        throw new IllegalStateException(String.format(
                                "Duplicate default for %s in %s and %s", key, previous, url));
                    }
                    values.put(key, properties.getProperty(key));
                }
                LOGGER.debug("Loaded {} default values from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return values;
    }
}
