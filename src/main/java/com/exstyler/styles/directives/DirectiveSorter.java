package com.exstyler.styles.directives;

import com.exstyler.ast.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders directives by their lowercased rendering, dropping later duplicates.
 */
public final class DirectiveSorter {

    private DirectiveSorter() {
    }

    public static List<Integer> sort(SyntaxTree tree, List<Integer> directives) {
        Map<String, Integer> unique = new LinkedHashMap<>();
        for (int directive : directives) {
            unique.putIfAbsent(tree.render(directive).toLowerCase(Locale.ROOT), directive);
        }

        List<Map.Entry<String, Integer>> entries = new ArrayList<>(unique.entrySet());
        entries.sort(Map.Entry.comparingByKey(Comparator.naturalOrder()));

        List<Integer> sorted = new ArrayList<>(entries.size());
        for (Map.Entry<String, Integer> entry : entries) {
            sorted.add(entry.getValue());
        }
        return sorted;
    }
}
