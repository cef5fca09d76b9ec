package com.goerdes.symbelf.components.parser;

import java.util.regex.Pattern;

/**
 * Rewrites disassembly lines so that different objdump versions print identical text for
 * identical machine code.
 */
public enum InstructionNormalizer {

    IDENTITY {
        @Override
        public String normalize(String line) {
            return line;
        }
    },

    /**
     * Opcode c3 is printed as <code>retq</code> or <code>ret</code> for x86-64, depending on the
     * objdump version (seen with 2.34 and 2.36.1). Always use <code>ret</code>.
     */
    X86_64 {
        private final Pattern retq = Pattern.compile("(^.*\\sc3\\s+)retq(.*)$");

        @Override
        public String normalize(String line) {
            return retq.matcher(line).replaceFirst("$1ret$2");
        }
    };

    static final String X86_64_FILE_FORMAT = "elf64-x86-64";

    public abstract String normalize(String line);

    /**
     * @param fileFormat detected file format, may be {@code null}
     * @return the normalizer for that format
     */
    public static InstructionNormalizer forFileFormat(String fileFormat) {
        return X86_64_FILE_FORMAT.equals(fileFormat) ? X86_64 : IDENTITY;
    }
}
