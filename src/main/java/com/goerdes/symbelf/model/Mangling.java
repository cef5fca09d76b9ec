package com.goerdes.symbelf.model;

import com.goerdes.symbelf.exception.FileProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Explicit mangled to demangled name mapping, for toolchains whose nm cannot demangle.
 */
public class Mangling {

    private static final Logger log = LoggerFactory.getLogger(Mangling.class);

    private static final Mangling NONE = new Mangling(Map.of());

    private final Map<String, String> mapping;

    public Mangling(Map<String, String> mapping) {
        this.mapping = Map.copyOf(mapping);
    }

    /** A mangling without entries. */
    public static Mangling none() {
        return NONE;
    }

    /**
     * Reads a mangling file. Lines alternate between a mangled name and its demangled form;
     * an unpaired last line is ignored. A file that does not exist yields {@link #none()}.
     *
     * @param file the mangling file
     * @return the loaded mapping
     * @throws FileProcessingException if the file exists but cannot be read
     */
    public static Mangling load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Mangling file '{}' not found, ignoring it", file);
            return none();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, UTF_8);
        } catch (IOException e) {
            throw new FileProcessingException("Unable to read mangling file " + file, e);
        }

        Map<String, String> mapping = new HashMap<>();
        for (int i = 0; i + 1 < lines.size(); i += 2) {
            mapping.put(lines.get(i), lines.get(i + 1));
        }
        Mangling mangling = new Mangling(mapping);
        log.info("Mangling info of {} symbols read from file '{}'", mangling.size(), file);
        return mangling;
    }

    public Optional<String> demangle(String mangledName) {
        return Optional.ofNullable(mapping.get(mangledName));
    }

    public int size() {
        return mapping.size();
    }
}
