package com.goerdes.symbelf.model;

/**
 * A compile unit named in the debug information.
 *
 * @param id       id the compile unit is registered under
 * @param filename source file name as reported by readelf
 */
public record SourceFile(int id, String filename) {}
