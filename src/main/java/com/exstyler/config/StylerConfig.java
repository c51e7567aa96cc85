package com.exstyler.config;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the styler: a general section plus one section per style.
 */
public class StylerConfig {
    public static final String STANDARD_LIBRARY_MODULES = "standard_library_modules";

    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> styleConfigs;

    public StylerConfig(Map<String, Object> generalConfig,
                        Map<String, Map<String, Object>> styleConfigs) {
        this.generalConfig = generalConfig;
        this.styleConfigs = styleConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the style configs map.
     */
    public Map<String, Map<String, Object>> getStyleConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : styleConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        return value != null ? (T) value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public <T> T getStyleConfig(String style, String key, T defaultValue) {
        try {
            Map<String, Object> styleConfig = styleConfigs.get(style);
            if (styleConfig == null) {
                return defaultValue;
            }

            Object value = styleConfig.get(key);
            if (value == null) {
                return defaultValue;
            }

            if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {

                if (defaultValue instanceof Integer && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                } else if (defaultValue instanceof Boolean && value instanceof String) {
                    return (T) Boolean.valueOf(value.toString());
                } else if (defaultValue instanceof String) {
                    return (T) value.toString();
                }

                return defaultValue;
            }

            return (T) value;
        } catch (Exception e) {
            return defaultValue;
        }
    }

    /**
     * Names listed under {@code key} in the general section.
     */
    public Set<String> getGeneralNameSet(String key) {
        return _toNameSet(generalConfig.get(key));
    }

    /**
     * Names listed under {@code key} in a style's section.
     */
    public Set<String> getStyleNameSet(String style, String key) {
        Map<String, Object> styleConfig = styleConfigs.get(style);
        return styleConfig == null ? Collections.emptySet() : _toNameSet(styleConfig.get(key));
    }

    private static Set<String> _toNameSet(Object value) {
        if (!(value instanceof Collection)) {
            return Collections.emptySet();
        }
        Set<String> names = new LinkedHashSet<>();
        for (Object item : (Collection<?>) value) {
            if (item != null) {
                names.add(item.toString());
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
