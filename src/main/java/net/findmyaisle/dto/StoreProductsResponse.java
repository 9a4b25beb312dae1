package net.findmyaisle.dto;

import net.findmyaisle.model.ProductRecord;

import java.util.List;

/**
 * Parsed products for a single store, ungrouped and uncached.
 */
public record StoreProductsResponse(String query, String storeName, String postalCode,
                                    List<ProductRecord> products, String source) {
}
