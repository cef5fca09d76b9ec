package com.goerdes.symbelf.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * One symbol of a binary, keyed by its mangled name.
 * <p>
 * Size, kind, instructions and source location are filled in by the parsing phases of
 * {@link Binary}. {@link #init()} runs once all phases are done; afterwards the instruction list
 * is frozen. Subclasses derive language specific name parts in {@link #initNames()}.
 * </p>
 */
@Getter
public abstract class Symbol {

    private final String mangledName;
    private final String displayName;
    private final boolean demangled;

    @Setter
    private long size;

    /** Storage class character as printed by nm, e.g. T, t, D, B, W. */
    @Setter
    private char kind;

    @Getter(AccessLevel.NONE)
    private List<String> instructions = new ArrayList<>();

    private Integer sourceFileId;
    private Integer sourceLine;
    private Integer sourceColumn;

    /** Scope part of the name, empty if there is none. */
    @Setter(AccessLevel.PROTECTED)
    private String namespace = "";

    /** Name without scope and argument list. */
    @Setter(AccessLevel.PROTECTED)
    private String bareName;

    /** Argument list including trailing qualifiers, or {@code null} for data symbols. */
    @Setter(AccessLevel.PROTECTED)
    private String arguments;

    private boolean initialized;

    protected Symbol(String mangledName, String displayName, boolean demangled) {
        this.mangledName = mangledName;
        this.displayName = displayName;
        this.demangled = demangled;
        this.bareName = displayName;
    }

    /**
     * Appends one disassembled instruction or one tagged source line.
     *
     * @throws IllegalStateException if the symbol has already been initialized
     */
    public void addInstructions(String instruction) {
        if (initialized) {
            throw new IllegalStateException("Symbol " + mangledName + " is already initialized");
        }
        instructions.add(instruction);
    }

    public List<String> getInstructions() {
        return initialized ? instructions : List.copyOf(instructions);
    }

    public void setSourceLocation(Integer fileId, Integer line, Integer column) {
        this.sourceFileId = fileId;
        this.sourceLine = line;
        this.sourceColumn = column;
    }

    /**
     * Finishes the symbol after all parsing phases. Calling it again has no effect.
     */
    public final void init() {
        if (initialized) {
            return;
        }
        instructions = List.copyOf(instructions);
        initNames();
        initialized = true;
    }

    protected abstract void initNames();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + mangledName + " -> " + displayName + ", size=" + size + ", kind=" + kind + "]";
    }
}
