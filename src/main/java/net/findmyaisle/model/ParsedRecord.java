package net.findmyaisle.model;

/**
 * A record recovered from source text. Implementations are only created with a
 * non-blank primary name.
 */
public interface ParsedRecord {

    /**
     * Identity used to deduplicate records within one response: the store id for
     * stores, the product name for products.
     */
    String dedupeKey();
}
