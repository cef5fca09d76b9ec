package com.goerdes.symbelf.utils;

/**
 * Markers around source lines that objdump interleaves with the disassembly, so consumers of
 * the instruction list can tell them apart from instructions.
 */
public final class SourceCodeTags {

    public static final String SOURCE_CODE_START_TAG = "...SRC_START...";
    public static final String SOURCE_CODE_END_TAG = "...SRC_END...";

    private SourceCodeTags() {
    }

    public static String tag(String sourceLine) {
        return SOURCE_CODE_START_TAG + sourceLine + SOURCE_CODE_END_TAG;
    }
}
