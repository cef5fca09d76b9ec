package com.goerdes.symbelf.exception;

/**
 * Raised when the debug-info dump contains an attribute value whose shape the parser does not
 * understand. This usually means an incompatible readelf version.
 */
public class DebugInfoParseException extends FileProcessingException {

    public DebugInfoParseException(String message) {
        super(message, null);
    }

}
