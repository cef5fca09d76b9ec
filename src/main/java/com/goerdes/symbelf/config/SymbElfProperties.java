package com.goerdes.symbelf.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the <code>symbelf</code> prefix in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "symbelf")
public class SymbElfProperties {

    /** Commands used to inspect binaries. */
    private Tools tools = new Tools();

    /** Symbol variant to create, <code>cpp</code> or <code>c</code>. */
    private String language = "cpp";

    /** Only symbols whose display name matches this regex are kept. */
    private String symbolSelectionRegex;

    /** Symbols whose display name matches this regex are dropped, even if selected. */
    private String symbolExclusionRegex;

    /** Optional file of alternating mangled/demangled lines. */
    private String manglingFile;

    @Data
    public static class Tools {
        private String objdump = "objdump";
        private String nm = "nm";
        private String readelf = "readelf";
        private String size = "size";
    }
}
