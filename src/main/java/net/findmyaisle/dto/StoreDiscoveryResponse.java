package net.findmyaisle.dto;

import net.findmyaisle.model.StoreRecord;

import java.util.List;

public record StoreDiscoveryResponse(String postalCode, List<StoreRecord> stores, String source, CacheStatus cache) {
}
