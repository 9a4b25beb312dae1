package net.findmyaisle.dto;

import java.util.List;

/**
 * One aggregation call.
 *
 * @param query product query as typed
 * @param postalCode location key, validated against {@code aggregation.postal-code-pattern}
 * @param storeIds optional allowlist; empty means discover stores for the postal code
 * @param enhance derive retailer product images from cited product pages
 */
public record AggregationRequest(String query, String postalCode, List<String> storeIds, boolean enhance) {

    public AggregationRequest {
        storeIds = storeIds == null ? List.of() : List.copyOf(storeIds);
    }
}
