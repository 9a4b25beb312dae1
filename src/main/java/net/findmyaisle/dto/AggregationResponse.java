package net.findmyaisle.dto;

import java.util.List;

public record AggregationResponse(String query,
                                  String location,
                                  List<String> storesConsidered,
                                  List<ProductGroup> results,
                                  String source,
                                  CacheStatus cache) {

    public static AggregationResponse of(AggregationPayload payload, CacheStatus cache) {
        return new AggregationResponse(payload.query(), payload.location(), payload.storesConsidered(),
            payload.results(), payload.source(), cache);
    }
}
