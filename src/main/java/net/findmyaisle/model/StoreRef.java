package net.findmyaisle.model;

/**
 * A candidate store for one aggregation call.
 */
public record StoreRef(String storeId, String storeName) {
}
