package com.goerdes.symbelf.components.parser;

import com.goerdes.symbelf.model.Symbol;
import com.goerdes.symbelf.utils.SourceCodeTags;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Distributes the lines of <code>objdump -drwS</code> to the symbols they belong to.
 * <p>
 * A header line such as <code>0000000000001129 &lt;_Z3foov&gt;:</code> selects the current
 * symbol. Instruction lines that follow are appended to it; any other non-blank line is
 * interleaved source and appended tagged. A section banner ends the current symbol. Lines
 * belonging to symbols that are not in the symbol table are dropped.
 * </p>
 */
@RequiredArgsConstructor
public class DisassemblyCollector {

    private static final String SECTION_LINE_PREFIX = "Disassembly of section ";

    private static final Pattern HEADER_LINE = Pattern.compile("^(0x)?[0-9A-Fa-f]+ <(.+)>:");
    private static final Pattern INSTRUCTION_LINE = Pattern.compile("^\\s*[0-9A-Fa-f]+:\\s*((?:\\s*[0-9a-fA-F]{2})+)\\s+(.*)");

    enum State {
        NO_CURRENT_SYMBOL,
        IN_CURRENT_SYMBOL
    }

    private final Map<String, Symbol> symbols;
    private final InstructionNormalizer normalizer;

    @Getter
    private State state = State.NO_CURRENT_SYMBOL;

    private Symbol currentSymbol;

    /** Instruction lines seen, whether or not they belonged to a known symbol. */
    @Getter
    private int instructionLineCount;

    public void collect(String objdumpOutput) {
        objdumpOutput.lines().forEach(this::processLine);
        submitSymbol();
    }

    void processLine(String rawLine) {
        String line = normalizer.normalize(rawLine);

        Matcher header = HEADER_LINE.matcher(line);
        if (header.lookingAt()) {
            submitSymbol();
            Symbol symbol = symbols.get(header.group(2));
            if (symbol != null) {
                currentSymbol = symbol;
                state = State.IN_CURRENT_SYMBOL;
            }
            return;
        }

        if (line.startsWith(SECTION_LINE_PREFIX)) {
            submitSymbol();
            return;
        }

        Matcher instruction = INSTRUCTION_LINE.matcher(line);
        boolean isInstruction = instruction.lookingAt();
        if (isInstruction) {
            instructionLineCount++;
        }

        if (state == State.NO_CURRENT_SYMBOL) {
            return;
        }

        if (isInstruction) {
            currentSymbol.addInstructions(instruction.group(2).stripTrailing());
        } else if (!line.isBlank()) {
            currentSymbol.addInstructions(SourceCodeTags.tag(line));
        }
    }

    /** Instructions are appended as they are read, so submitting only resets the state. */
    private void submitSymbol() {
        currentSymbol = null;
        state = State.NO_CURRENT_SYMBOL;
    }
}
