package com.goerdes.symbelf.components.parser;

import com.goerdes.symbelf.components.DemanglingResolver;
import com.goerdes.symbelf.components.SymbolSelectionFilter;
import com.goerdes.symbelf.model.DemangledName;
import com.goerdes.symbelf.model.Symbol;
import com.goerdes.symbelf.model.SymbolFactory;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates symbols from two nm listings of the same binary, one with mangled and one with
 * demangled names. Both listings are expected to have the same order and length, so line
 * <i>i</i> of one describes the same symbol as line <i>i</i> of the other.
 */
@RequiredArgsConstructor
public class SymbolPropertyExtractor {

    private static final Logger log = LoggerFactory.getLogger(SymbolPropertyExtractor.class);

    /** address, size, kind, name */
    private static final Pattern NM_LINE = Pattern.compile("^[0-9A-Fa-f]+\\s([0-9A-Fa-f]+)\\s(\\w)\\s(.+)");

    private final Map<String, Symbol> symbols;
    private final SymbolFactory symbolFactory;
    private final SymbolSelectionFilter selectionFilter;
    private final DemanglingResolver demanglingResolver;

    /** Symbols rejected by the selection filter. */
    @Getter
    private int numSymbolsDropped;

    /**
     * Adds a symbol for every new, selected mangled name and updates size and kind of names
     * that are already known.
     *
     * @param mangledListing   output of <code>nm --print-size --size-sort --radix=d</code>
     * @param demangledListing same with <code>-C</code>
     */
    public void extract(String mangledListing, String demangledListing) {
        List<String> mangledLines = mangledListing.lines().toList();
        List<String> demangledLines = demangledListing.lines().toList();
        if (mangledLines.size() != demangledLines.size()) {
            log.warn("nm listings differ in length ({} mangled vs. {} demangled lines), pairing the first {}",
                    mangledLines.size(), demangledLines.size(), Math.min(mangledLines.size(), demangledLines.size()));
        }

        for (int i = 0, n = Math.min(mangledLines.size(), demangledLines.size()); i < n; i++) {
            processPair(mangledLines.get(i), demangledLines.get(i));
        }
    }

    private void processPair(String mangledLine, String demangledLine) {
        Matcher mangled = NM_LINE.matcher(mangledLine);
        if (!mangled.lookingAt()) {
            return;
        }

        long size;
        try {
            size = Long.parseLong(mangled.group(1));
        } catch (NumberFormatException e) {
            log.debug("Skipping nm line with non-decimal size: {}", mangledLine);
            return;
        }
        char kind = mangled.group(2).charAt(0);
        String mangledName = mangled.group(3);

        Symbol known = symbols.get(mangledName);
        if (known != null) {
            known.setSize(size);
            known.setKind(kind);
            return;
        }

        Matcher demangled = NM_LINE.matcher(demangledLine);
        String toolCandidate = demangled.lookingAt() ? demangled.group(3) : mangledName;
        DemangledName name = demanglingResolver.resolve(mangledName, toolCandidate);

        if (!selectionFilter.isSelected(name.name())) {
            numSymbolsDropped++;
            return;
        }

        Symbol symbol = symbolFactory.create(mangledName, name.name(), name.demangled());
        symbol.setSize(size);
        symbol.setKind(kind);
        symbols.put(mangledName, symbol);
    }
}
