package com.goerdes.symbelf.components;

import com.goerdes.symbelf.components.tools.BinaryTools;
import com.goerdes.symbelf.config.SymbElfProperties;
import com.goerdes.symbelf.model.Binary;
import com.goerdes.symbelf.model.Mangling;
import com.goerdes.symbelf.model.SymbolFactory;
import com.goerdes.symbelf.model.SymbolLanguage;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Builds {@link Binary} instances with the configured tools, symbol language, selection
 * patterns and mangling file. The mangling file is read once, when the factory is created.
 */
@Component
public class BinaryFactory {

    private final BinaryTools tools;
    private final SymbolFactory symbolFactory;
    private final SymbolSelectionFilter selectionFilter;
    private final Mangling mangling;

    public BinaryFactory(BinaryTools tools, SymbElfProperties properties) {
        this.tools = tools;
        this.symbolFactory = SymbolLanguage.fromSetting(properties.getLanguage());
        this.selectionFilter = SymbolSelectionFilter.of(properties.getSymbolSelectionRegex(), properties.getSymbolExclusionRegex());
        this.mangling = properties.getManglingFile() == null || properties.getManglingFile().isBlank()
                ? Mangling.none()
                : Mangling.load(Path.of(properties.getManglingFile()));
    }

    /**
     * Models a binary.
     *
     * @param filename  path of the binary
     * @param selection decides which symbols are modelled, e.g. {@link #getSelectionFilter()}
     * @param warnings  receives the non-fatal problems of this binary
     */
    public Binary create(String filename, SymbolSelectionFilter selection, WarningRegistry warnings) {
        return new Binary(filename, tools, symbolFactory, selection, mangling, warnings);
    }

    /** The selection filter built from the configuration. */
    public SymbolSelectionFilter getSelectionFilter() {
        return selectionFilter;
    }
}
