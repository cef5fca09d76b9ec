package com.goerdes.symbelf.components.parser;

import com.goerdes.symbelf.exception.DebugInfoParseException;
import com.goerdes.symbelf.model.SourceFile;
import com.goerdes.symbelf.model.Symbol;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attaches source locations from <code>readelf --debug-dump=info</code> to known symbols and
 * registers the compile units as source files.
 * <pre>
 *  &lt;1&gt;&lt;2d&gt;: Abbrev Number: 2 (DW_TAG_subprogram)
 *     &lt;32&gt;   DW_AT_decl_file   : 1
 *     &lt;33&gt;   DW_AT_decl_line   : 3
 *     &lt;34&gt;   DW_AT_decl_column : 5
 *     &lt;35&gt;   DW_AT_linkage_name: (indirect string, offset: 0x10): _Z3foov
 * </pre>
 * Attributes are accumulated per entry and flushed when the next entry starts.
 */
@RequiredArgsConstructor
public class DebugInfoCollector {

    private static final Logger log = LoggerFactory.getLogger(DebugInfoCollector.class);

    private static final Pattern HEADER_LINE = Pattern.compile("\\s*<[0-9a-f]+>\\s*<[0-9a-f]+>:\\s+Abbrev Number:\\s*(\\d+)\\s+\\((\\w+)\\).*");
    private static final Pattern ATTRIBUTE_LINE = Pattern.compile("\\s*<[0-9a-f]+>\\s+(\\S+)\\s*:\\s*(\\S.*)");

    /** Either a bare token or <code>(form description): token</code>. */
    private static final Pattern NAME_VALUE = Pattern.compile("(?:\\([^)]*\\):\\s*)?([^\\s(].*?)\\s*");
    private static final Pattern INTEGER_VALUE = Pattern.compile("(0x[0-9a-fA-F]+|\\d+)");

    static final String TAG_COMPILE_UNIT = "DW_TAG_compile_unit";
    static final String AT_LINKAGE_NAME = "DW_AT_linkage_name";
    static final String AT_MIPS_LINKAGE_NAME = "DW_AT_MIPS_linkage_name";
    static final String AT_DECL_FILE = "DW_AT_decl_file";
    static final String AT_DECL_LINE = "DW_AT_decl_line";
    static final String AT_DECL_COLUMN = "DW_AT_decl_column";
    static final String AT_NAME = "DW_AT_name";

    enum State {
        AWAITING_HEADER,
        ACCUMULATING_ATTRIBUTES
    }

    private final Map<String, Symbol> symbols;
    private final Map<Integer, SourceFile> sourceFiles;

    @Getter
    private State state = State.AWAITING_HEADER;

    private int headerId;
    private String headerTag;

    private String pendingMangledName;
    private Integer pendingSourceId;
    private Integer pendingSourceLine;
    private Integer pendingSourceColumn;

    /**
     * @param readelfOutput the debug-info dump
     * @throws DebugInfoParseException if a linkage or compile unit name cannot be read
     */
    public void collect(String readelfOutput) {
        readelfOutput.lines().forEach(this::processLine);
        flushSymbolInfo();
    }

    void processLine(String line) {
        Matcher header = HEADER_LINE.matcher(line);
        if (header.lookingAt()) {
            flushSymbolInfo();
            headerId = Integer.parseInt(header.group(1));
            headerTag = header.group(2);
            state = State.ACCUMULATING_ATTRIBUTES;
            return;
        }

        if (state == State.AWAITING_HEADER) {
            return;
        }

        Matcher attribute = ATTRIBUTE_LINE.matcher(line);
        if (!attribute.lookingAt()) {
            return;
        }

        String value = attribute.group(2);
        switch (attribute.group(1)) {
            case AT_LINKAGE_NAME, AT_MIPS_LINKAGE_NAME -> pendingMangledName = parseName(value, line);
            case AT_DECL_FILE -> pendingSourceId = parseInteger(value, line);
            case AT_DECL_LINE -> pendingSourceLine = parseInteger(value, line);
            case AT_DECL_COLUMN -> pendingSourceColumn = parseInteger(value, line);
            case AT_NAME -> {
                if (TAG_COMPILE_UNIT.equals(headerTag)) {
                    sourceFiles.put(headerId, new SourceFile(headerId, parseName(value, line)));
                }
            }
            default -> {
            }
        }
    }

    private void flushSymbolInfo() {
        if (pendingMangledName != null) {
            Symbol symbol = symbols.get(pendingMangledName);
            if (symbol != null) {
                symbol.setSourceLocation(pendingSourceId, pendingSourceLine, pendingSourceColumn);
            }
        }
        pendingMangledName = null;
        pendingSourceId = null;
        pendingSourceLine = null;
        pendingSourceColumn = null;
    }

    private static String parseName(String value, String line) {
        Matcher m = NAME_VALUE.matcher(value);
        if (!m.matches()) {
            throw new DebugInfoParseException("Undecipherable debug info line '" + line + "'");
        }
        return m.group(1);
    }

    private static Integer parseInteger(String value, String line) {
        Matcher m = INTEGER_VALUE.matcher(value);
        if (!m.lookingAt()) {
            log.debug("Ignoring non-numeric debug info line '{}'", line);
            return null;
        }
        String number = m.group(1);
        try {
            return number.startsWith("0x") ? Integer.parseInt(number.substring(2), 16) : Integer.parseInt(number);
        } catch (NumberFormatException e) {
            log.debug("Ignoring out of range value in debug info line '{}'", line);
            return null;
        }
    }
}
