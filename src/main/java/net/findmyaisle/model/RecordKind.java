package net.findmyaisle.model;

/**
 * The two record shapes a source answer can be parsed into.
 */
public enum RecordKind {
    STORE,
    PRODUCT
}
