package io.fullerstack.structured.config;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;

/**
 * Hierarchical configuration using ResourceBundle (zero dependencies).
 *
 * <p>Supports fallback chain:
 * <ol>
 *   <li>System properties</li>
 *   <li>config_{scope}.properties (scope-specific, optional)</li>
 *   <li>config.properties (global defaults)</li>
 * </ol>
 *
 * <p><strong>Keys:</strong>
 * <pre>
 * # config.properties
 * dispatcher.thread-name-prefix=dispatcher
 * dispatcher.shutdown-timeout-ms=5000
 *
 * # config_feed.properties
 * feed.clear-progress-on-failure=true
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <p>System properties take precedence over all property files:
 * <pre>
 * java -Dfeed.clear-progress-on-failure=false -jar app.jar
 * </pre>
 */
public class HierarchicalConfig {

    private static final String BUNDLE = "config";
    private static final ResourceBundle.Control PROPERTIES_ONLY =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    // null when the scope has no file of its own
    private final ResourceBundle scoped;
    private final ResourceBundle global;
    private final String context;

    private HierarchicalConfig(ResourceBundle scoped, ResourceBundle global, String context) {
        this.scoped = scoped;
        this.global = global;
        this.context = context;
    }

    /**
     * Get global configuration (config.properties).
     *
     * @return Global configuration
     * @throws ConfigurationException if config.properties is not on the classpath
     */
    public static HierarchicalConfig global() {
        return new HierarchicalConfig(null, loadGlobal(), "global");
    }

    /**
     * Get scope-specific configuration, falling back to the global file.
     *
     * @param scopeName Scope name (e.g., "feed" reads config_feed.properties)
     * @return Scope-specific configuration
     */
    public static HierarchicalConfig forScope(String scopeName) {
        Objects.requireNonNull(scopeName, "scopeName cannot be null");
        if (scopeName.isBlank()) {
            throw new IllegalArgumentException("scopeName cannot be blank");
        }

        ResourceBundle scoped;
        try {
            scoped = ResourceBundle.getBundle(BUNDLE + "_" + scopeName, Locale.ROOT, PROPERTIES_ONLY);
        } catch (MissingResourceException e) {
            scoped = null;
        }
        return new HierarchicalConfig(scoped, loadGlobal(), "scope:" + scopeName);
    }

    private static ResourceBundle loadGlobal() {
        try {
            return ResourceBundle.getBundle(BUNDLE, Locale.ROOT, PROPERTIES_ONLY);
        } catch (MissingResourceException e) {
            throw new ConfigurationException("Missing " + BUNDLE + ".properties on the classpath", e);
        }
    }

    private String lookup(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }
        if (scoped != null && scoped.containsKey(key)) {
            return scoped.getString(key);
        }
        return global.containsKey(key) ? global.getString(key) : null;
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    /**
     * Get string value.
     *
     * @param key Property key
     * @return Property value
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String value = lookup(key);
        if (value == null) {
            throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
        }
        return value;
    }

    /**
     * Get string value with default.
     *
     * @param key Property key
     * @param defaultValue Default if not found
     * @return Property value or default
     */
    public String getString(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get long value.
     *
     * @param key Property key
     * @return Property value as long
     * @throws ConfigurationException if key not found or invalid format
     */
    public long getLong(String key) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid long value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * Get long value with default. Unparseable values also yield the default.
     */
    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Get boolean value. Only "true" and "false" (any case) are accepted.
     *
     * @param key Property key
     * @return Property value as boolean
     * @throws ConfigurationException if key not found or not a boolean
     */
    public boolean getBoolean(String key) {
        String value = getString(key).trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException("Invalid boolean value for key '" + key + "': " + value);
    }

    /**
     * Get boolean value with default.
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * Check if key exists in configuration.
     *
     * @param key Property key
     * @return true if key exists
     */
    public boolean contains(String key) {
        return lookup(key) != null;
    }

    /**
     * Get all keys defined by the property files of this configuration level.
     *
     * @return Set of all keys, scope-specific ones first
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        if (scoped != null) {
            keys.addAll(scoped.keySet());
        }
        keys.addAll(global.keySet());
        return keys;
    }

    /**
     * Get configuration context (for debugging).
     *
     * @return Context description (e.g., "global", "scope:feed")
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "HierarchicalConfig[context=" + context + "]";
    }
}
