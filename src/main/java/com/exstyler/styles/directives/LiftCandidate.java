package com.exstyler.styles.directives;

import java.util.List;

/**
 * A fully qualified reference chain seen often enough to deserve an alias.
 */
public class LiftCandidate {
    private final List<String> chain;
    private int occurrences;

    public LiftCandidate(List<String> chain) {
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }

    /**
     * The name the chain is referred to by once aliased.
     */
    public String getShortName() {
        return chain.get(chain.size() - 1);
    }

    public int getOccurrences() {
        return occurrences;
    }

    void countOccurrence() {
        occurrences++;
    }

    public String dotted() {
        return String.join(".", chain);
    }

    @Override
    public String toString() {
        return dotted() + " x" + occurrences;
    }
}
