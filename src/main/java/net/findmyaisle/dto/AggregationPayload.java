package net.findmyaisle.dto;

import java.util.List;

/**
 * The cacheable part of an aggregation result.
 */
public record AggregationPayload(String query,
                                 String location,
                                 List<String> storesConsidered,
                                 List<ProductGroup> results,
                                 String source) {
}
