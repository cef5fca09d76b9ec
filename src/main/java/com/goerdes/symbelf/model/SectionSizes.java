package com.goerdes.symbelf.model;

/**
 * Section totals as reported by the Berkeley <code>size</code> format.
 */
public record SectionSizes(long text, long data, long bss, long overall) {

    /** Code plus initialized data, i.e. what has to be stored in flash. */
    public long progMemSize() {
        return text + data;
    }

    /** Initialized plus zero-initialized data, i.e. statically allocated RAM. */
    public long staticRamSize() {
        return data + bss;
    }
}
