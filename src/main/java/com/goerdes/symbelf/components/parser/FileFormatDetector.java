package com.goerdes.symbelf.components.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FileFormatDetector {

    private static final Pattern FILE_FORMAT = Pattern.compile("file format\\s+(\\S+)");

    private FileFormatDetector() {
    }

    /**
     * Extracts the BFD target name, e.g. <code>elf64-x86-64</code> or <code>elf32-avr</code>,
     * from the output of <code>objdump -a</code>.
     *
     * @param objdumpOutput archive header dump
     * @return the file format, or empty if objdump did not report one
     */
    public static Optional<String> detect(String objdumpOutput) {
        Matcher m = FILE_FORMAT.matcher(objdumpOutput);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
