package net.findmyaisle.dto;

import net.findmyaisle.model.StoreRecord;

import java.util.List;

/**
 * Stores found for one postal code and where they came from
 * ({@code perplexity_sonar} or {@code static_coverage}).
 */
public record StoreDiscoveryPayload(String postalCode, List<StoreRecord> stores, String source) {
}
