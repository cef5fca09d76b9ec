package com.goerdes.symbelf.components;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects non-fatal problems found while building one binary, for the caller to report
 * alongside the result.
 */
public class WarningRegistry {

    private static final Logger log = LoggerFactory.getLogger(WarningRegistry.class);

    private final List<String> warnings = new ArrayList<>();

    public synchronized void warning(String message) {
        log.warn(message);
        warnings.add(message);
    }

    public synchronized boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public synchronized List<String> getWarnings() {
        return List.copyOf(warnings);
    }
}
