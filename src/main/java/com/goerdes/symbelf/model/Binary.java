package com.goerdes.symbelf.model;

import com.goerdes.symbelf.components.DemanglingResolver;
import com.goerdes.symbelf.components.SymbolSelectionFilter;
import com.goerdes.symbelf.components.WarningRegistry;
import com.goerdes.symbelf.components.parser.DebugInfoCollector;
import com.goerdes.symbelf.components.parser.DisassemblyCollector;
import com.goerdes.symbelf.components.parser.FileFormatDetector;
import com.goerdes.symbelf.components.parser.InstructionNormalizer;
import com.goerdes.symbelf.components.parser.SizeSummaryParser;
import com.goerdes.symbelf.components.parser.SymbolPropertyExtractor;
import com.goerdes.symbelf.components.tools.BinaryTools;
import com.goerdes.symbelf.exception.FileProcessingException;
import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Symbol model of one binary, built from the output of objdump, size, nm and readelf.
 * <p>
 * The constructor runs every phase in a fixed order: file format detection, section sizes,
 * symbol properties, disassembly, debug information and finally the initialization of all
 * symbols in mangled name order. Later phases only refine symbols created by the nm phase.
 * Once constructed the binary is not modified any more.
 * </p>
 */
@Getter
public class Binary {

    private static final Logger log = LoggerFactory.getLogger(Binary.class);

    private final String filename;

    private String fileFormat;

    private long textSize;
    private long dataSize;
    private long bssSize;
    private long overallSize;
    private long progMemSize;
    private long staticRamSize;

    /** False if the size utility did not understand the binary; nm demangling is not trusted then. */
    private boolean toolsReliable = true;

    private boolean instructionsAvailable;

    private int numSymbolsDropped;

    private final Map<String, Symbol> symbols = new TreeMap<>();
    private final Map<Integer, SourceFile> sourceFiles = new HashMap<>();

    @Getter(AccessLevel.NONE)
    private final BinaryTools tools;
    @Getter(AccessLevel.NONE)
    private final SymbolFactory symbolFactory;
    @Getter(AccessLevel.NONE)
    private final SymbolSelectionFilter selectionFilter;
    @Getter(AccessLevel.NONE)
    private final Mangling mangling;
    @Getter(AccessLevel.NONE)
    private final WarningRegistry warnings;

    /**
     * Builds the model of the given file.
     *
     * @param filename        path of the binary
     * @param tools           binutils front end
     * @param symbolFactory   creates the language specific symbol variant
     * @param selectionFilter decides which symbols are modelled
     * @param mangling        explicit demangling table, {@link Mangling#none()} if there is none
     * @param warnings        receives non-fatal problems
     * @throws FileProcessingException if the file does not exist, a tool cannot be run or the
     *                                 debug information is not understood
     */
    public Binary(String filename,
                  BinaryTools tools,
                  SymbolFactory symbolFactory,
                  SymbolSelectionFilter selectionFilter,
                  Mangling mangling,
                  WarningRegistry warnings) {
        if (filename == null || filename.isBlank()) {
            throw new FileProcessingException("No binary filename defined", null);
        }
        if (!Files.isRegularFile(Path.of(filename))) {
            throw new FileProcessingException("Unable to find filename " + filename, null);
        }

        this.filename = filename;
        this.tools = tools;
        this.symbolFactory = symbolFactory;
        this.selectionFilter = selectionFilter;
        this.mangling = mangling;
        this.warnings = warnings;

        determineFileFormat();
        determineSectionSizes();
        gatherSymbolProperties();
        gatherSymbolInstructions();
        gatherDebugInformation();
        initSymbols();

        log.info("Binary '{}': {} symbols modelled, {} dropped", filename, symbols.size(), numSymbolsDropped);
    }

    public Optional<String> getFileFormat() {
        return Optional.ofNullable(fileFormat);
    }

    /** Symbols by mangled name, iterated in mangled name order. */
    public Map<String, Symbol> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    public Map<Integer, SourceFile> getSourceFiles() {
        return Collections.unmodifiableMap(sourceFiles);
    }

    private void determineFileFormat() {
        FileFormatDetector.detect(tools.archiveHeaders(filename)).ifPresentOrElse(format -> {
            fileFormat = format;
            log.info("File format of binary {}: {}", filename, format);
        }, () -> log.info("Unable to detect binary file format of {}", filename));
    }

    private void determineSectionSizes() {
        SizeSummaryParser.parse(tools.sizeSummary(filename)).ifPresentOrElse(sizes -> {
            textSize = sizes.text();
            dataSize = sizes.data();
            bssSize = sizes.bss();
            overallSize = sizes.overall();
            progMemSize = sizes.progMemSize();
            staticRamSize = sizes.staticRamSize();
        }, () -> {
            warnings.warning("Unable to determine resource consumptions. Is the proper size utility used?");
            toolsReliable = false;
        });
    }

    private void gatherSymbolProperties() {
        SymbolPropertyExtractor extractor = new SymbolPropertyExtractor(
                symbols, symbolFactory, selectionFilter, new DemanglingResolver(mangling, toolsReliable));
        extractor.extract(tools.symbolListing(filename, false), tools.symbolListing(filename, true));
        numSymbolsDropped = extractor.getNumSymbolsDropped();
    }

    private void gatherSymbolInstructions() {
        DisassemblyCollector collector = new DisassemblyCollector(symbols, InstructionNormalizer.forFileFormat(fileFormat));
        collector.collect(tools.disassembly(filename));

        instructionsAvailable = collector.getInstructionLineCount() > 0;
        if (!instructionsAvailable) {
            warnings.warning("Unable to read assembly from binary '" + filename + "'.");
        }
    }

    private void gatherDebugInformation() {
        new DebugInfoCollector(symbols, sourceFiles).collect(tools.debugInfo(filename));
    }

    private void initSymbols() {
        symbols.values().forEach(Symbol::init);
    }
}
