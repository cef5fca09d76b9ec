package com.goerdes.symbelf.model;

/**
 * Creates the {@link Symbol} variant matching the analysed language.
 */
@FunctionalInterface
public interface SymbolFactory {

    Symbol create(String mangledName, String displayName, boolean demangled);

}
