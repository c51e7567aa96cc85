package com.exstyler.core;

import com.exstyler.api.Refactoring;
import com.exstyler.config.ConfigurationLoader;
import com.exstyler.config.StylerConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Per-run state handed to every style: the resolved configuration values and the
 * refactorings applied so far. A fresh context is created for every tree.
 */
public class StyleContext {
    private final Set<String> aliasLiftingExclude;
    private final Set<String> standardLibraryModules;
    private final List<String> moduledocSkipSuffixes;
    private final List<Refactoring> refactorings = new ArrayList<>();

    public StyleContext(Set<String> aliasLiftingExclude,
                        Set<String> standardLibraryModules,
                        List<String> moduledocSkipSuffixes) {
        this.aliasLiftingExclude = Set.copyOf(aliasLiftingExclude);
        this.standardLibraryModules = Set.copyOf(standardLibraryModules);
        this.moduledocSkipSuffixes = List.copyOf(moduledocSkipSuffixes);
    }

    public static StyleContext from(StylerConfig config) {
        return new StyleContext(
                config.getStyleNameSet(ConfigurationLoader.MODULE_DIRECTIVES, ConfigurationLoader.ALIAS_LIFTING_EXCLUDE),
                config.getGeneralNameSet(StylerConfig.STANDARD_LIBRARY_MODULES),
                new ArrayList<>(config.getStyleNameSet(
                        ConfigurationLoader.MODULE_DIRECTIVES, ConfigurationLoader.MODULEDOC_SKIP_SUFFIXES)));
    }

    /**
     * Short names that alias lifting must never introduce.
     */
    public Set<String> getAliasLiftingExclude() {
        return aliasLiftingExclude;
    }

    public Set<String> getStandardLibraryModules() {
        return standardLibraryModules;
    }

    public List<String> getModuledocSkipSuffixes() {
        return moduledocSkipSuffixes;
    }

    public void record(Refactoring refactoring) {
        refactorings.add(refactoring);
    }

    public List<Refactoring> getRefactorings() {
        return Collections.unmodifiableList(refactorings);
    }
}
