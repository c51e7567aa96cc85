package com.exstyler.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of styling one tree.
 */
public class StyleReport {
    private final boolean changed;
    private final String styledCode;
    private final List<Refactoring> appliedRefactorings;
    private final List<String> failedStyles;

    private StyleReport(Builder builder) {
        this.changed = builder.changed;
        this.styledCode = builder.styledCode;
        this.appliedRefactorings = builder.appliedRefactorings;
        this.failedStyles = builder.failedStyles;
    }

    /**
     * Whether the rendered tree differs from the input.
     */
    public boolean isChanged() {
        return changed;
    }

    public String getStyledCode() {
        return styledCode;
    }

    public List<Refactoring> getAppliedRefactorings() {
        return appliedRefactorings;
    }

    /**
     * Styles that failed unexpectedly and left the tree as they found it.
     */
    public List<String> getFailedStyles() {
        return failedStyles;
    }

    public boolean hasRefactoring(String type) {
        return appliedRefactorings.stream().anyMatch(r -> r.getType().equals(type));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean changed;
        private String styledCode;
        private List<Refactoring> appliedRefactorings = new ArrayList<>();
        private List<String> failedStyles = new ArrayList<>();

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder styledCode(String styledCode) {
            this.styledCode = styledCode;
            return this;
        }

        public Builder appliedRefactorings(List<Refactoring> refactorings) {
            this.appliedRefactorings = new ArrayList<>(refactorings);
            return this;
        }

        public Builder addFailedStyle(String style) {
            this.failedStyles.add(style);
            return this;
        }

        public StyleReport build() {
            return new StyleReport(this);
        }
    }
}
