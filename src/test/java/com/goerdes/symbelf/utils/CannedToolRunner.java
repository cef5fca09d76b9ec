package com.goerdes.symbelf.utils;

import com.goerdes.symbelf.components.tools.ToolRunner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.goerdes.symbelf.utils.TestUtils.toolOutput;

/**
 * {@link ToolRunner} answering with canned output. Commands are keyed without their last
 * argument, the binary's filename, e.g. <code>"nm --print-size --size-sort --radix=d -C"</code>.
 * Unknown commands produce no output.
 */
public class CannedToolRunner implements ToolRunner {

    public static final String ARCHIVE_HEADERS = "objdump -a";
    public static final String SIZE = "size";
    public static final String NM_MANGLED = "nm --print-size --size-sort --radix=d";
    public static final String NM_DEMANGLED = "nm --print-size --size-sort --radix=d -C";
    public static final String DISASSEMBLY = "objdump -drwS";
    public static final String DEBUG_INFO = "readelf --debug-dump=info";

    private final Map<String, String> outputs = new HashMap<>();
    private final List<String> invocations = new ArrayList<>();

    /** Runner serving the demo binary fixtures for every tool. */
    public static CannedToolRunner demoBinary() {
        return new CannedToolRunner()
                .with(ARCHIVE_HEADERS, toolOutput("objdump-archive-headers.txt"))
                .with(SIZE, toolOutput("size.txt"))
                .with(NM_MANGLED, toolOutput("nm-mangled.txt"))
                .with(NM_DEMANGLED, toolOutput("nm-demangled.txt"))
                .with(DISASSEMBLY, toolOutput("objdump-disassembly.txt"))
                .with(DEBUG_INFO, toolOutput("readelf-debug-info.txt"));
    }

    public CannedToolRunner with(String command, String output) {
        outputs.put(command, output);
        return this;
    }

    public List<String> getInvocations() {
        return invocations;
    }

    @Override
    public String run(String executable, List<String> arguments) {
        List<String> parts = new ArrayList<>();
        parts.add(executable);
        parts.addAll(arguments.subList(0, arguments.size() - 1));
        String command = String.join(" ", parts);
        invocations.add(command);
        return outputs.getOrDefault(command, "");
    }
}
