package com.goerdes.symbelf.components.parser;

import com.goerdes.symbelf.model.SectionSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SizeSummaryParser {

    private static final Logger log = LoggerFactory.getLogger(SizeSummaryParser.class);

    private static final Pattern SIZE_LINE = Pattern.compile("^\\s*([0-9]+)\\s+([0-9]+)\\s+([0-9]+)\\s+([0-9]+)");

    private SizeSummaryParser() {
    }

    /**
     * Reads text, data, bss and overall size from the first matching line of
     * <code>size</code> output in Berkeley format:
     * <pre>
     *    text    data     bss     dec     hex filename
     *    1234     100      20    1354     54a firmware.elf
     * </pre>
     *
     * @param sizeOutput raw output of the size utility
     * @return the sizes, or empty if no line has four leading numbers or a number exceeds the
     *         {@code long} range
     */
    public static Optional<SectionSizes> parse(String sizeOutput) {
        return sizeOutput.lines()
                .map(SIZE_LINE::matcher)
                .filter(Matcher::lookingAt)
                .findFirst()
                .flatMap(SizeSummaryParser::toSectionSizes);
    }

    private static Optional<SectionSizes> toSectionSizes(Matcher m) {
        try {
            return Optional.of(new SectionSizes(
                    Long.parseLong(m.group(1)),
                    Long.parseLong(m.group(2)),
                    Long.parseLong(m.group(3)),
                    Long.parseLong(m.group(4))));
        } catch (NumberFormatException e) {
            log.debug("Section size out of range in size line '{}'", m.group());
            return Optional.empty();
        }
    }
}
