package net.findmyaisle.service;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.config.AggregationProperties;
import net.findmyaisle.dto.CacheStatus;
import net.findmyaisle.dto.StoreDiscoveryPayload;
import net.findmyaisle.dto.StoreDiscoveryResponse;
import net.findmyaisle.exception.InvalidAggregationRequestException;
import net.findmyaisle.model.RecordKind;
import net.findmyaisle.model.StoreRecord;
import net.findmyaisle.service.source.PrimarySourceClient;
import net.findmyaisle.service.source.SourcePrompts;
import net.findmyaisle.support.cache.CacheKeys;
import net.findmyaisle.support.parsing.TextRecordParser;
import net.findmyaisle.util.LoggingUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds grocery stores serving a postal code.
 *
 * <p>Order of preference: cached result, then the primary source's store listing,
 * then the static coverage table. Only primary-source results are cached so a
 * temporary outage does not pin the coarse static list for a whole TTL.</p>
 */
@Slf4j
@Service
public class StoreDiscoveryService {

    public static final String SOURCE_PRIMARY = "perplexity_sonar";
    public static final String SOURCE_STATIC = "static_coverage";

    private static final String NATIONWIDE = "00000-99999";

    private final PrimarySourceClient primarySource;
    private final TextRecordParser parser;
    private final AggregationCache cache;
    private final AggregationProperties properties;

    public StoreDiscoveryService(PrimarySourceClient primarySource,
                                 TextRecordParser parser,
                                 AggregationCache cache,
                                 AggregationProperties properties) {
        this.primarySource = primarySource;
        this.parser = parser;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * @throws InvalidAggregationRequestException when the postal code is malformed
     */
    public Mono<StoreDiscoveryResponse> getNearbyStores(String postalCode) {
        if (!properties.isValidPostalCode(postalCode)) {
            throw new InvalidAggregationRequestException("Invalid postal code: " + postalCode);
        }
        String key = CacheKeys.storesKey(postalCode);
        Optional<StoreDiscoveryPayload> cached = cache.getJson(key, StoreDiscoveryPayload.class);
        if (cached.isPresent()) {
            boolean nearStale = cache.isNearStale(key, properties.getStoresTtl(), properties.getNearStaleRatio());
            return Mono.just(toResponse(cached.get(), new CacheStatus(true, nearStale)));
        }

        return discoverThroughPrimary(postalCode)
            .map(stores -> {
                if (stores.isEmpty()) {
                    log.info("No stores found via {} for {}, falling back to static coverage", primarySource.name(), postalCode);
                    return new StoreDiscoveryPayload(postalCode, staticCoverage(postalCode), SOURCE_STATIC);
                }
                StoreDiscoveryPayload payload = new StoreDiscoveryPayload(postalCode, stores, SOURCE_PRIMARY);
                cache.setJson(key, payload, properties.getStoresTtl());
                return payload;
            })
            .map(payload -> toResponse(payload, CacheStatus.miss()));
    }

    private Mono<List<StoreRecord>> discoverThroughPrimary(String postalCode) {
        if (!primarySource.isConfigured()) {
            return Mono.just(List.of());
        }
        return primarySource.query(SourcePrompts.storePrompt(postalCode))
            .map(response -> parser.parse(response.text(), RecordKind.STORE).stream()
                .filter(StoreRecord.class::isInstance)
                .map(StoreRecord.class::cast)
                .toList())
            .timeout(properties.getPerStoreTimeout())
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Store discovery via {} failed for {}", primarySource.name(), postalCode);
                return Mono.just(List.of());
            });
    }

    List<StoreRecord> staticCoverage(String postalCode) {
        if (!postalCode.chars().allMatch(Character::isDigit)) {
            return List.of();
        }
        int postal = Integer.parseInt(postalCode);
        List<StoreRecord> stores = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : properties.getCoverage().entrySet()) {
            if (entry.getValue().stream().anyMatch(range -> inRange(postal, range))) {
                String storeId = entry.getKey();
                stores.add(new StoreRecord(storeId, properties.displayNameFor(storeId), null,
                    new LinkedHashSet<>(properties.coverageServicesFor(storeId)), null, null));
            }
        }
        return stores;
    }

    private static boolean inRange(int postal, String range) {
        String trimmed = range.trim();
        if (NATIONWIDE.equals(trimmed)) {
            return true;
        }
        String[] bounds = trimmed.split("-");
        if (bounds.length != 2) {
            log.warn("Ignoring malformed coverage range '{}'", range);
            return false;
        }
        try {
            return Integer.parseInt(bounds[0].trim()) <= postal && postal <= Integer.parseInt(bounds[1].trim());
        } catch (NumberFormatException ex) {
            LoggingUtils.warn(log, ex, "Ignoring malformed coverage range '{}'", range);
            return false;
        }
    }

    private static StoreDiscoveryResponse toResponse(StoreDiscoveryPayload payload, CacheStatus cacheStatus) {
        return new StoreDiscoveryResponse(payload.postalCode(), payload.stores(), payload.source(), cacheStatus);
    }
}
