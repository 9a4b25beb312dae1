package net.findmyaisle.service;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.config.AggregationProperties;
import net.findmyaisle.dto.AggregationDtoMapper;
import net.findmyaisle.dto.AggregationPayload;
import net.findmyaisle.dto.AggregationRequest;
import net.findmyaisle.dto.AggregationResponse;
import net.findmyaisle.dto.CacheStatus;
import net.findmyaisle.dto.StoreProductsResponse;
import net.findmyaisle.exception.InvalidAggregationRequestException;
import net.findmyaisle.exception.SourceNotConfiguredException;
import net.findmyaisle.model.CanonicalProduct;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.SourceTag;
import net.findmyaisle.model.StoreRecord;
import net.findmyaisle.model.StoreRef;
import net.findmyaisle.service.source.PrimarySourceClient;
import net.findmyaisle.service.source.SecondarySourceClient;
import net.findmyaisle.support.cache.CacheKeys;
import net.findmyaisle.util.ExternalApiLogger;
import net.findmyaisle.util.LoggingUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Product-first search across several stores near a postal code.
 *
 * <p>Per request: validate, look up the cache, resolve the candidate stores (caller
 * allowlist or discovery, at most {@code aggregation.max-stores}), query the primary
 * source for every store under a concurrency limit with a per-store timeout, fall
 * back to the secondary source for stores that produced no products, group the
 * offers into canonical products and cache the result.</p>
 *
 * <p>A failing or slow store only removes that store's offers; the call itself still
 * completes with whatever the other stores returned.</p>
 */
@Slf4j
@Service
public class ProductAggregationOrchestrator {

    static final String SOURCE_PRIMARY_ONLY = "aggregate(sonar)";
    static final String SOURCE_WITH_SECONDARY = "aggregate(sonar+serper)";

    private final PrimarySourceClient primarySource;
    private final SecondarySourceClient secondarySource;
    private final StoreProductSearchService productSearch;
    private final StoreDiscoveryService storeDiscovery;
    private final OfferGrouper offerGrouper;
    private final AggregationCache cache;
    private final AggregationProperties properties;

    public ProductAggregationOrchestrator(PrimarySourceClient primarySource,
                                          SecondarySourceClient secondarySource,
                                          StoreProductSearchService productSearch,
                                          StoreDiscoveryService storeDiscovery,
                                          OfferGrouper offerGrouper,
                                          AggregationCache cache,
                                          AggregationProperties properties) {
        this.primarySource = primarySource;
        this.secondarySource = secondarySource;
        this.productSearch = productSearch;
        this.storeDiscovery = storeDiscovery;
        this.offerGrouper = offerGrouper;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * Runs one aggregation.
     *
     * @throws InvalidAggregationRequestException for a malformed postal code or blank query, before any I/O
     */
    public Mono<AggregationResponse> aggregate(AggregationRequest request) {
        validate(request.query(), request.postalCode());
        String query = request.query().trim();
        String postalCode = request.postalCode().trim();
        List<String> allowlist = capStoreIds(request.storeIds());

        String key = CacheKeys.productsKey(postalCode, query, allowlist, request.enhance());
        Optional<AggregationPayload> cached = cache.getJson(key, AggregationPayload.class);
        if (cached.isPresent()) {
            boolean nearStale = cache.isNearStale(key, properties.getProductsTtl(), properties.getNearStaleRatio());
            log.info("Aggregation cache hit for '{}' in {} (nearStale={})", query, postalCode, nearStale);
            return Mono.just(AggregationResponse.of(cached.get(), new CacheStatus(true, nearStale)));
        }

        if (!primarySource.isConfigured()) {
            return Mono.error(new SourceNotConfiguredException(primarySource.name()));
        }

        return resolveStores(allowlist, postalCode)
            .flatMap(stores -> fanOut(stores, query, postalCode, request.enhance())
                .map(hits -> buildPayload(query, postalCode, stores, hits)))
            .doOnNext(payload -> cache.setJson(key, payload, properties.getProductsTtl()))
            .map(payload -> AggregationResponse.of(payload, CacheStatus.miss()));
    }

    /**
     * Primary-source products for a single store, ungrouped and uncached. A failed
     * source call yields an empty product list.
     */
    public Mono<StoreProductsResponse> searchStore(String query, String storeName, String postalCode, boolean enhance) {
        validate(query, postalCode);
        if (!StringUtils.hasText(storeName)) {
            throw new InvalidAggregationRequestException("storeName must not be blank");
        }
        if (!primarySource.isConfigured()) {
            return Mono.error(new SourceNotConfiguredException(primarySource.name()));
        }
        String trimmedQuery = query.trim();
        String trimmedStore = storeName.trim();
        return productSearch.searchProducts(trimmedQuery, trimmedStore, postalCode.trim(), enhance)
            .timeout(properties.getPerStoreTimeout())
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Product search for '{}' at {} failed", trimmedQuery, trimmedStore);
                return Mono.just(List.of());
            })
            .map(products -> new StoreProductsResponse(trimmedQuery, trimmedStore, postalCode.trim(), products,
                SourceTag.PERPLEXITY_SONAR.tag()));
    }

    private void validate(String query, String postalCode) {
        if (!StringUtils.hasText(query)) {
            throw new InvalidAggregationRequestException("query must not be blank");
        }
        if (postalCode == null || !properties.isValidPostalCode(postalCode.trim())) {
            throw new InvalidAggregationRequestException("Invalid postal code: " + postalCode);
        }
    }

    private List<String> capStoreIds(List<String> storeIds) {
        List<String> normalized = new ArrayList<>();
        for (String storeId : storeIds) {
            if (storeId == null) {
                continue;
            }
            String id = storeId.trim().toLowerCase(Locale.ROOT);
            if (!id.isEmpty() && !normalized.contains(id)) {
                normalized.add(id);
            }
        }
        return normalized.size() > properties.getMaxStores()
            ? List.copyOf(normalized.subList(0, properties.getMaxStores()))
            : List.copyOf(normalized);
    }

    private Mono<List<StoreRef>> resolveStores(List<String> allowlist, String postalCode) {
        if (!allowlist.isEmpty()) {
            return Mono.just(allowlist.stream()
                .map(id -> new StoreRef(id, properties.displayNameFor(id)))
                .toList());
        }
        return storeDiscovery.getNearbyStores(postalCode)
            .map(response -> response.stores().stream()
                .map(StoreRecord::toRef)
                .limit(properties.getMaxStores())
                .toList());
    }

    private Mono<List<StoreProductHit>> fanOut(List<StoreRef> stores, String query, String postalCode, boolean enhance) {
        ExternalApiLogger.logAggregationStart(log, query, postalCode, stores.size());
        return Flux.fromIterable(stores)
            .flatMap(store -> fetchStore(store, query, postalCode, enhance), properties.getMaxConcurrency())
            .collectList()
            .map(perStore -> {
                List<StoreProductHit> hits = new ArrayList<>();
                perStore.forEach(hits::addAll);
                return hits;
            });
    }

    private Mono<List<StoreProductHit>> fetchStore(StoreRef store, String query, String postalCode, boolean enhance) {
        return productSearch.searchProducts(query, store.storeName(), postalCode, enhance)
            .timeout(properties.getPerStoreTimeout())
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Primary source failed for store {} ('{}')", store.storeId(), query);
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of())
            .flatMap(products -> products.isEmpty()
                ? secondaryFallback(store, query)
                : Mono.just(toHits(store, products, SourceTag.PERPLEXITY_SONAR)));
    }

    private Mono<List<StoreProductHit>> secondaryFallback(StoreRef store, String query) {
        if (!secondarySource.isConfigured()) {
            log.debug("No primary products for {} and {} is not configured", store.storeId(), secondarySource.name());
            return Mono.just(List.of());
        }
        ExternalApiLogger.logSecondaryFallback(log, store.storeId(), query, "no primary products");
        return secondarySource.searchShopping(query, store, properties.getSecondaryLocationHint())
            .timeout(properties.getPerStoreTimeout())
            .map(rows -> toHits(store, rows, SourceTag.SERPER_SHOPPING))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Secondary source failed for store {} ('{}')", store.storeId(), query);
                return Mono.just(List.of());
            })
            .defaultIfEmpty(List.of());
    }

    private static List<StoreProductHit> toHits(StoreRef store, List<ProductRecord> products, SourceTag source) {
        return products.stream()
            .map(product -> new StoreProductHit(store, product, source))
            .toList();
    }

    private AggregationPayload buildPayload(String query, String postalCode, List<StoreRef> stores, List<StoreProductHit> hits) {
        List<CanonicalProduct> products = offerGrouper.group(hits);
        boolean usedSecondary = hits.stream().anyMatch(hit -> hit.source() == SourceTag.SERPER_SHOPPING);
        ExternalApiLogger.logAggregationComplete(log, query, postalCode, products.size(), hits.size());
        return new AggregationPayload(
            query,
            postalCode,
            stores.stream().map(StoreRef::storeId).toList(),
            AggregationDtoMapper.toGroups(products),
            usedSecondary ? SOURCE_WITH_SECONDARY : SOURCE_PRIMARY_ONLY);
    }
}
