package com.goerdes.symbelf.components;

import org.junit.jupiter.api.Test;

import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class SymbolSelectionFilterTest {

    @Test
    void acceptAllSelectsEverything() {
        SymbolSelectionFilter filter = SymbolSelectionFilter.acceptAll();

        assertTrue(filter.isSelected("foo()"));
        assertTrue(filter.isSelected(""));
    }

    @Test
    void selectionMatchesAtStartOfName() {
        SymbolSelectionFilter filter = SymbolSelectionFilter.of("ns::", null);

        assertTrue(filter.isSelected("ns::Counter::increment()"));
        assertFalse(filter.isSelected("other::ns::helper()"));
        assertFalse(filter.isSelected("main"));
    }

    @Test
    void exclusionDominatesSelection() {
        SymbolSelectionFilter filter = SymbolSelectionFilter.of("ns::", "ns::Counter");

        assertFalse(filter.isSelected("ns::Counter::increment()"));
        assertTrue(filter.isSelected("ns::Timer::start()"));
    }

    @Test
    void exclusionAloneKeepsTheRest() {
        SymbolSelectionFilter filter = SymbolSelectionFilter.of(null, "_");

        assertFalse(filter.isSelected("_init"));
        assertTrue(filter.isSelected("main"));
    }

    @Test
    void blankPatternsCountAsUnset() {
        SymbolSelectionFilter filter = SymbolSelectionFilter.of("  ", "");

        assertTrue(filter.isSelected("anything"));
    }

    @Test
    void invalidPatternIsRejected() {
        assertThrows(PatternSyntaxException.class, () -> SymbolSelectionFilter.of("foo(", null));
    }
}
