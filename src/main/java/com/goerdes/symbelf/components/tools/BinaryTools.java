package com.goerdes.symbelf.components.tools;

import com.goerdes.symbelf.config.SymbElfProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Knows which binutils command produces which dump of a binary.
 */
@Component
@RequiredArgsConstructor
public class BinaryTools {

    private final ToolRunner toolRunner;
    private final SymbElfProperties properties;

    /** <code>objdump -a</code>, used to detect the file format. */
    public String archiveHeaders(String filename) {
        return toolRunner.run(properties.getTools().getObjdump(), List.of("-a", filename));
    }

    /** Berkeley style <code>size</code> summary. */
    public String sizeSummary(String filename) {
        return toolRunner.run(properties.getTools().getSize(), List.of(filename));
    }

    /**
     * <code>nm</code> listing with decimal sizes, sorted by size.
     *
     * @param demangle whether nm should demangle the names itself
     */
    public String symbolListing(String filename, boolean demangle) {
        List<String> args = new ArrayList<>(List.of("--print-size", "--size-sort", "--radix=d"));
        if (demangle) {
            args.add("-C");
        }
        args.add(filename);
        return toolRunner.run(properties.getTools().getNm(), args);
    }

    /** Disassembly with relocations and interleaved source, one instruction per line. */
    public String disassembly(String filename) {
        return toolRunner.run(properties.getTools().getObjdump(), List.of("-drwS", filename));
    }

    /** DWARF <code>.debug_info</code> dump. */
    public String debugInfo(String filename) {
        return toolRunner.run(properties.getTools().getReadelf(), List.of("--debug-dump=info", filename));
    }
}
