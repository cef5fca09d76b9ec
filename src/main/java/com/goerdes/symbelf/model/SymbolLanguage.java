package com.goerdes.symbelf.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Languages whose symbols can be modelled, selected by the <code>symbelf.language</code> setting.
 */
public enum SymbolLanguage implements SymbolFactory {

    CPP("cpp") {
        @Override
        public Symbol create(String mangledName, String displayName, boolean demangled) {
            return new CppSymbol(mangledName, displayName, demangled);
        }
    },

    C("c") {
        @Override
        public Symbol create(String mangledName, String displayName, boolean demangled) {
            return new CSymbol(mangledName, displayName, demangled);
        }
    };

    private final String setting;

    SymbolLanguage(String setting) {
        this.setting = setting;
    }

    /**
     * @param setting language key, case-insensitive
     * @throws IllegalArgumentException if no language uses that key
     */
    public static SymbolLanguage fromSetting(String setting) {
        String key = setting == null ? "" : setting.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.setting.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported symbol language: " + setting));
    }
}
