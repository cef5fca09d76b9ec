package com.goerdes.symbelf.components;

import java.util.regex.Pattern;

/**
 * Decides by display name whether a symbol is modelled at all. Patterns match at the start of
 * the name; the exclusion pattern always wins over the selection pattern.
 */
public class SymbolSelectionFilter {

    private static final SymbolSelectionFilter ACCEPT_ALL = new SymbolSelectionFilter(null, null);

    private final Pattern selection;
    private final Pattern exclusion;

    private SymbolSelectionFilter(Pattern selection, Pattern exclusion) {
        this.selection = selection;
        this.exclusion = exclusion;
    }

    public static SymbolSelectionFilter acceptAll() {
        return ACCEPT_ALL;
    }

    /**
     * @param selectionRegex regex a name has to match, {@code null} or blank to select all
     * @param exclusionRegex regex that rejects a name, {@code null} or blank to exclude none
     * @throws java.util.regex.PatternSyntaxException if a regex is invalid
     */
    public static SymbolSelectionFilter of(String selectionRegex, String exclusionRegex) {
        return new SymbolSelectionFilter(compile(selectionRegex), compile(exclusionRegex));
    }

    private static Pattern compile(String regex) {
        return regex == null || regex.isBlank() ? null : Pattern.compile(regex);
    }

    public boolean isSelected(String displayName) {
        if (exclusion != null && exclusion.matcher(displayName).lookingAt()) {
            return false;
        }
        return selection == null || selection.matcher(displayName).lookingAt();
    }
}
