package me.christianrobert.onig2js.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.onig2js.transformer.context.ConversionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime configuration of the converter.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>{@code conversion.add-global-flag}: emit the {@code g} flag (default true)</li>
 *   <li>{@code conversion.max-nesting-depth}: maximum tree depth (default 256)</li>
 *   <li>{@code conversion.include-node-tree}: attach a tree dump to results (default false)</li>
 * </ul>
 *
 * <p>Values may be set as typed objects or as strings.</p>
 */
@ApplicationScoped
public class ConfigService {

    public static final String ADD_GLOBAL_FLAG = "conversion.add-global-flag";
    public static final String MAX_NESTING_DEPTH = "conversion.max-nesting-depth";
    public static final String INCLUDE_NODE_TREE = "conversion.include-node-tree";

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(ADD_GLOBAL_FLAG, ConversionOptions.DEFAULT_ADD_GLOBAL_FLAG);
        configuration.put(MAX_NESTING_DEPTH, ConversionOptions.DEFAULT_MAX_NESTING_DEPTH);
        configuration.put(INCLUDE_NODE_TREE, ConversionOptions.DEFAULT_INCLUDE_NODE_TREE);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return null;
    }

    /**
     * @return The value as an integer, or null if it is missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Builds conversion options from the current configuration. Missing or
     * invalid values fall back to the defaults.
     */
    public ConversionOptions getConversionOptions() {
        Boolean addGlobalFlag = getConfigValueAsBoolean(ADD_GLOBAL_FLAG);
        Integer maxNestingDepth = getConfigValueAsInteger(MAX_NESTING_DEPTH);
        Boolean includeNodeTree = getConfigValueAsBoolean(INCLUDE_NODE_TREE);

        if (maxNestingDepth != null && maxNestingDepth < 1) {
            log.warn("Ignoring non-positive {} = {}", MAX_NESTING_DEPTH, maxNestingDepth);
            maxNestingDepth = null;
        }

        return new ConversionOptions(
                addGlobalFlag != null ? addGlobalFlag : ConversionOptions.DEFAULT_ADD_GLOBAL_FLAG,
                maxNestingDepth != null ? maxNestingDepth : ConversionOptions.DEFAULT_MAX_NESTING_DEPTH,
                includeNodeTree != null ? includeNodeTree : ConversionOptions.DEFAULT_INCLUDE_NODE_TREE);
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
