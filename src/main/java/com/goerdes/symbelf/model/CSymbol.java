package com.goerdes.symbelf.model;

/**
 * Symbol of a C binary. C names carry neither scope nor signature.
 */
public class CSymbol extends Symbol {

    public CSymbol(String mangledName, String displayName, boolean demangled) {
        super(mangledName, displayName, demangled);
    }

    @Override
    protected void initNames() {
        setNamespace("");
        setBareName(getDisplayName());
        setArguments(null);
    }
}
