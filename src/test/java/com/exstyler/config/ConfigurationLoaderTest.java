package com.exstyler.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationLoaderTest {

    private static Path _resource(String name) throws URISyntaxException {
        return Paths.get(ConfigurationLoaderTest.class.getResource("/config/" + name).toURI());
    }

    @Test
    @DisplayName("Bundled defaults list standard library modules and skip suffixes")
    void defaults() {
        StylerConfig config = ConfigurationLoader.loadDefaultConfig();

        Set<String> stdlib = config.getGeneralNameSet(StylerConfig.STANDARD_LIBRARY_MODULES);
        assertTrue(stdlib.containsAll(List.of("List", "Supervisor", "Enum", "GenServer")));
        assertTrue(config.getStyleNameSet(ConfigurationLoader.MODULE_DIRECTIVES,
                ConfigurationLoader.ALIAS_LIFTING_EXCLUDE).isEmpty());
        assertTrue(config.getStyleNameSet(ConfigurationLoader.MODULE_DIRECTIVES,
                ConfigurationLoader.MODULEDOC_SKIP_SUFFIXES).containsAll(List.of("Test", "Controller", "JSON")));
    }

    @Test
    @DisplayName("Default configuration is loaded once")
    void defaultsAreCached() {
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    @DisplayName("User values override defaults, missing keys are filled in")
    void userConfig() throws URISyntaxException {
        StylerConfig config = ConfigurationLoader.loadConfig(_resource("custom-config.yml"));

        assertEquals(Set.of("Enum", "Map"), config.getGeneralNameSet(StylerConfig.STANDARD_LIBRARY_MODULES));
        assertEquals(Set.of("Repo"), config.getStyleNameSet(ConfigurationLoader.MODULE_DIRECTIVES,
                ConfigurationLoader.ALIAS_LIFTING_EXCLUDE));
        assertTrue(config.getStyleNameSet(ConfigurationLoader.MODULE_DIRECTIVES,
                ConfigurationLoader.MODULEDOC_SKIP_SUFFIXES).contains("Mixfile"));
    }

    @Test
    @DisplayName("Invalid sections and values fall back to defaults")
    void invalidSections() throws URISyntaxException {
        StylerConfig config = ConfigurationLoader.loadConfig(_resource("invalid-sections.yml"));

        assertTrue(config.getGeneralNameSet(StylerConfig.STANDARD_LIBRARY_MODULES).contains("Supervisor"));
        assertTrue(config.getStyleNameSet(ConfigurationLoader.MODULE_DIRECTIVES,
                ConfigurationLoader.MODULEDOC_SKIP_SUFFIXES).contains("View"));
    }

    @Test
    @DisplayName("Missing, empty and malformed files yield the defaults")
    void fallbacks() throws URISyntaxException {
        StylerConfig defaults = ConfigurationLoader.loadDefaultConfig();

        assertSame(defaults, ConfigurationLoader.loadConfig(null));
        assertSame(defaults, ConfigurationLoader.loadConfig(Paths.get("does-not-exist", ".styler.yml")));
        assertSame(defaults, ConfigurationLoader.loadConfig(_resource("empty.yml")));
        assertSame(defaults, ConfigurationLoader.loadConfig(_resource("malformed.yml")));
    }

    @Test
    @DisplayName("Typed lookups convert or fall back")
    void typedLookups() {
        StylerConfig config = ConfigurationLoader.loadDefaultConfig();

        assertEquals("fallback", config.getStyleConfig("unknown_style", "key", "fallback"));
        assertEquals(7, (int) config.getGeneralConfig("missing", 7));
        assertTrue(config.getStyleNameSet("unknown_style", "names").isEmpty());
    }
}
