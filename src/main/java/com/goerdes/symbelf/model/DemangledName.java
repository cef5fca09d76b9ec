package com.goerdes.symbelf.model;

/**
 * Result of name resolution.
 *
 * @param name      name to display
 * @param demangled whether {@code name} is trusted to be demangled
 */
public record DemangledName(String name, boolean demangled) {}
