package com.goerdes.symbelf.components;

import com.goerdes.symbelf.model.DemangledName;
import com.goerdes.symbelf.model.Mangling;
import lombok.RequiredArgsConstructor;

/**
 * Picks the display name of a symbol. An explicit {@link Mangling} entry wins; otherwise the
 * name nm printed with <code>-C</code> is trusted as long as the binutils proved to work.
 */
@RequiredArgsConstructor
public class DemanglingResolver {

    private final Mangling mangling;

    /** Whether the binutils in use understand the binary, see {@code Binary#isToolsReliable()}. */
    private final boolean toolsReliable;

    /**
     * @param mangledName   name from the mangled nm listing
     * @param toolCandidate name from the demangling nm listing
     * @return the resolved display name
     */
    public DemangledName resolve(String mangledName, String toolCandidate) {
        return mangling.demangle(mangledName)
                .map(name -> new DemangledName(name, true))
                .orElseGet(() -> toolsReliable
                        ? new DemangledName(toolCandidate, true)
                        : new DemangledName(mangledName, false));
    }
}
