package io.taskrelay.server.config;

import java.util.Optional;

/**
 * Source of the {@code a2a.*} configuration properties.
 * <p>
 * The default {@link DefaultValuesConfigProvider} reads packaged defaults and lets system
 * properties override them. Integrations can supply their own provider to bridge to the
 * configuration system of their runtime.
 */
public interface A2AConfigProvider {

    /**
     * @param name the property name
     * @return the property value
     * @throws IllegalArgumentException if the property is not defined
     */
    String getValue(String name);

    /**
     * @param name the property name
     * @return the property value, or empty if not defined
     */
    Optional<String> getOptionalValue(String name);
}
