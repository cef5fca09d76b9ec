package com.goerdes.symbelf.exception;

/**
 * Raised when a binary cannot be turned into a symbol model at all.
 */
public class FileProcessingException extends RuntimeException {

    public FileProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
