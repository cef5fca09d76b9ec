package com.goerdes.symbelf.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;

/**
 * Serializable snapshot of a {@link Binary}, handed to clients of the REST API.
 */
@JsonInclude(NON_NULL)
public record BinaryOverview(
        String filename,
        String fileFormat,
        long textSize,
        long dataSize,
        long bssSize,
        long overallSize,
        long progMemSize,
        long staticRamSize,
        boolean toolsReliable,
        boolean instructionsAvailable,
        int numSymbolsDropped,
        List<SymbolOverview> symbols,
        Map<Integer, String> sourceFiles,
        List<String> warnings
) {

    /**
     * @param binary   the finished binary
     * @param filename name to report, e.g. the original upload name instead of a temp path
     * @param warnings warnings raised while building the binary
     */
    public static BinaryOverview of(Binary binary, String filename, List<String> warnings) {
        Map<Integer, String> sourceFiles = new TreeMap<>();
        binary.getSourceFiles().forEach((id, file) -> sourceFiles.put(id, file.filename()));

        return new BinaryOverview(
                filename,
                binary.getFileFormat().orElse(null),
                binary.getTextSize(),
                binary.getDataSize(),
                binary.getBssSize(),
                binary.getOverallSize(),
                binary.getProgMemSize(),
                binary.getStaticRamSize(),
                binary.isToolsReliable(),
                binary.isInstructionsAvailable(),
                binary.getNumSymbolsDropped(),
                binary.getSymbols().values().stream().map(SymbolOverview::of).toList(),
                sourceFiles,
                warnings
        );
    }

    @JsonInclude(NON_NULL)
    public record SymbolOverview(
            String mangledName,
            String displayName,
            boolean demangled,
            String namespace,
            String bareName,
            String arguments,
            long size,
            String kind,
            List<String> instructions,
            Integer sourceFileId,
            Integer sourceLine,
            Integer sourceColumn
    ) {
        static SymbolOverview of(Symbol s) {
            return new SymbolOverview(
                    s.getMangledName(),
                    s.getDisplayName(),
                    s.isDemangled(),
                    s.getNamespace(),
                    s.getBareName(),
                    s.getArguments(),
                    s.getSize(),
                    String.valueOf(s.getKind()),
                    s.getInstructions(),
                    s.getSourceFileId(),
                    s.getSourceLine(),
                    s.getSourceColumn()
            );
        }
    }
}
