package org.javelin.transpiler.types;

/**
 * One component of a variant record, with its type as written in the union declaration.
 */
public record VariantField(String name, String type) {
}
