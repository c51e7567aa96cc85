package com.exstyler.config;

import com.exstyler.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads styler configuration from YAML, filling anything missing from the bundled defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String MODULE_DIRECTIVES = "module_directives";
    public static final String ALIAS_LIFTING_EXCLUDE = "alias_lifting_exclude";
    public static final String MODULEDOC_SKIP_SUFFIXES = "moduledoc_skip_suffixes";

    private static final List<String> FALLBACK_SKIP_SUFFIXES = List.of(
            "Test", "Mixfile", "MixProject", "Controller", "Endpoint", "Repo",
            "Router", "Socket", "View", "HTML", "JSON");

    private static StylerConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static StylerConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.info("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            StylerConfig stylerConfig = _createConfigFromMap(config, loadDefaultConfig());
            logger.info("Configuration loaded successfully with " +
                    stylerConfig.getStyleConfigsMap().size() + " style configurations");

            return stylerConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized StylerConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config, _createEmptyConfig());
            logger.info("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Creates a configuration from a parsed Map, taking missing values from {@code defaults}.
     */
    @SuppressWarnings("unchecked")
    private static StylerConfig _createConfigFromMap(Map<String, Object> config, StylerConfig defaults) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> styleConfigs = new HashMap<>();
        if (config.get("styles") instanceof Map) {
            Map<String, Object> stylesMap = (Map<String, Object>) config.get("styles");

            for (Map.Entry<String, Object> entry : stylesMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    styleConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for style '" + entry.getKey() + "', using defaults");
                    styleConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else if (config.containsKey("styles")) {
            logger.warning("Invalid 'styles' section in config, using defaults");
        }

        _validateNameList(generalConfig, StylerConfig.STANDARD_LIBRARY_MODULES);
        Map<String, Object> directivesConfig = styleConfigs.computeIfAbsent(MODULE_DIRECTIVES, k -> new HashMap<>());
        _validateNameList(directivesConfig, ALIAS_LIFTING_EXCLUDE);
        _validateNameList(directivesConfig, MODULEDOC_SKIP_SUFFIXES);

        _ensureDefaults(generalConfig, defaults.getGeneralConfigMap());
        Map<String, Map<String, Object>> defaultStyles = defaults.getStyleConfigsMap();
        for (Map.Entry<String, Map<String, Object>> entry : defaultStyles.entrySet()) {
            _ensureDefaults(styleConfigs.computeIfAbsent(entry.getKey(), k -> new HashMap<>()), entry.getValue());
        }

        return new StylerConfig(generalConfig, styleConfigs);
    }

    /**
     * Keeps only the string entries of a name list; removes the key when it is not a list.
     */
    private static void _validateNameList(Map<String, Object> config, String key) {
        if (!config.containsKey(key)) {
            return;
        }
        Object value = config.get(key);
        if (!(value instanceof List)) {
            logger.warning("Configuration value '" + key + "' must be a list of names. Using default value.");
            config.remove(key);
            return;
        }

        List<String> names = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item instanceof String && !((String) item).isBlank()) {
                names.add(((String) item).trim());
            } else {
                logger.warning("Ignoring invalid entry '" + item + "' in configuration value '" + key + "'");
            }
        }
        config.put(key, names);
    }

    private static void _ensureDefaults(Map<String, Object> config, Map<String, Object> defaults) {
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            config.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Creates an empty configuration with minimum defaults.
     */
    private static StylerConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        generalConfig.put(StylerConfig.STANDARD_LIBRARY_MODULES, new ArrayList<String>());

        Map<String, Object> directivesConfig = new HashMap<>();
        directivesConfig.put(ALIAS_LIFTING_EXCLUDE, new ArrayList<String>());
        directivesConfig.put(MODULEDOC_SKIP_SUFFIXES, new ArrayList<>(FALLBACK_SKIP_SUFFIXES));

        Map<String, Map<String, Object>> styleConfigs = new HashMap<>();
        styleConfigs.put(MODULE_DIRECTIVES, directivesConfig);

        return new StylerConfig(generalConfig, styleConfigs);
    }
}
