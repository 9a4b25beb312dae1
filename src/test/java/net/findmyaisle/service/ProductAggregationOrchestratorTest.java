package net.findmyaisle.service;

import net.findmyaisle.config.AggregationProperties;
import net.findmyaisle.dto.AggregationRequest;
import net.findmyaisle.dto.AggregationResponse;
import net.findmyaisle.dto.CacheStatus;
import net.findmyaisle.dto.OfferView;
import net.findmyaisle.dto.ProductGroup;
import net.findmyaisle.dto.StoreDiscoveryResponse;
import net.findmyaisle.exception.CacheOperationException;
import net.findmyaisle.exception.InvalidAggregationRequestException;
import net.findmyaisle.exception.SourceNotConfiguredException;
import net.findmyaisle.exception.SourceUnavailableException;
import net.findmyaisle.model.PriceValue;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.RawSourceResponse;
import net.findmyaisle.model.SourceTag;
import net.findmyaisle.model.StoreRecord;
import net.findmyaisle.model.StoreRef;
import net.findmyaisle.service.source.PrimarySourceClient;
import net.findmyaisle.service.source.SecondarySourceClient;
import net.findmyaisle.support.cache.CacheStore;
import net.findmyaisle.support.cache.CaffeineCacheStore;
import net.findmyaisle.support.cache.JsonPayloadCodec;
import net.findmyaisle.support.parsing.TextRecordParser;
import net.findmyaisle.testutil.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductAggregationOrchestratorTest {

    private static final String TARGET_ANSWER = """
        PRODUCT: Oatly Original
        BRAND: Oatly
        PRICE: $4.99
        SIZE: 32 oz
        AVAILABILITY: in stock

        PRODUCT: Silk Original
        BRAND: Silk
        PRICE: $5.99
        SIZE: 59 oz
        AVAILABILITY: in stock
        """;

    private static final String WALMART_ANSWER = """
        PRODUCT: Silk Original
        BRAND: Silk
        PRICE: $5.49
        SIZE: 59 Ounces
        """;

    @Mock
    private PrimarySourceClient primarySource;

    @Mock
    private SecondarySourceClient secondarySource;

    @Mock
    private StoreDiscoveryService storeDiscovery;

    private AggregationProperties properties;
    private FakeTicker ticker;
    private ProductAggregationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new AggregationProperties();
        properties.setPerStoreTimeout(Duration.ofMillis(300));
        properties.setStoreNames(Map.of("whole_foods", "Whole Foods Market"));
        ticker = new FakeTicker();
        orchestrator = orchestrator(new CaffeineCacheStore(100, ticker));

        lenient().when(primarySource.name()).thenReturn("Sonar");
        lenient().when(primarySource.isConfigured()).thenReturn(true);
        lenient().when(secondarySource.name()).thenReturn("Serper");
        lenient().when(primarySource.query(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains(" at Target in ")) {
                return Mono.just(RawSourceResponse.textOnly(TARGET_ANSWER));
            }
            if (prompt.contains(" at Walmart in ")) {
                return Mono.just(RawSourceResponse.textOnly(WALMART_ANSWER));
            }
            if (prompt.contains(" at Kroger in ")) {
                return Mono.never();
            }
            return Mono.just(RawSourceResponse.textOnly(""));
        });
    }

    @Test
    @DisplayName("groups offers across stores and falls back to shopping search for a store with no answer")
    void aggregate_endToEndOatMilk() {
        ProductRecord shoppingRow = new ProductRecord("Silk Original Oat Milk", null, PriceValue.of(5.49), null, null,
            "In Stock", null, null, "https://www.wholefoodsmarket.com/product/silk-oat", null);
        when(secondarySource.isConfigured()).thenReturn(true);
        when(secondarySource.searchShopping(eq("oat milk"), eq(new StoreRef("whole_foods", "Whole Foods Market")),
            eq("United States"))).thenReturn(Mono.just(List.of(shoppingRow)));

        AggregationResponse response = orchestrator.aggregate(
            new AggregationRequest("oat milk", "60622", List.of("target", "whole_foods"), false)).block();

        assertThat(response).isNotNull();
        assertThat(response.storesConsidered()).containsExactly("target", "whole_foods");
        assertThat(response.cache()).isEqualTo(CacheStatus.miss());
        assertThat(response.source()).isEqualTo(ProductAggregationOrchestrator.SOURCE_WITH_SECONDARY);
        assertThat(response.results()).extracting(ProductGroup::groupKey)
            .containsExactlyInAnyOrder("oatly|oatly original|32 oz", "silk|silk original|59 oz");

        ProductGroup silk = group(response, "silk|silk original|59 oz");
        assertThat(silk.offers()).extracting(OfferView::storeId).containsExactly("target", "whole_foods");
        assertThat(silk.offers().get(1).source()).contains(SourceTag.SERPER_SHOPPING);
        assertThat(silk.offers().get(1).price()).isEqualTo(PriceValue.of(5.49));
        assertThat(silk.canonicalProduct().name()).isEqualTo("Silk Original");
    }

    @Test
    @DisplayName("a store that times out contributes no offers and the call still completes")
    void aggregate_toleratesSlowStore() {
        when(secondarySource.isConfigured()).thenReturn(false);

        StepVerifier.create(orchestrator.aggregate(
                new AggregationRequest("oat milk", "60622", List.of("target", "kroger", "walmart"), false)))
            .assertNext(response -> {
                assertThat(response.storesConsidered()).containsExactly("target", "kroger", "walmart");
                assertThat(response.source()).isEqualTo(ProductAggregationOrchestrator.SOURCE_PRIMARY_ONLY);
                List<String> offerStores = new ArrayList<>();
                response.results().forEach(g -> g.offers().forEach(o -> offerStores.add(o.storeId())));
                assertThat(offerStores).contains("target", "walmart").doesNotContain("kroger");
                assertThat(group(response, "silk|silk original|59 oz").offers()).hasSize(2);
            })
            .verifyComplete();
    }

    @Test
    void aggregate_fallsBackToSecondaryWhenPrimaryFails() {
        when(primarySource.query(anyString()))
            .thenReturn(Mono.error(new SourceUnavailableException("Sonar", SourceUnavailableException.Reason.TIMEOUT, "slow")));
        when(secondarySource.isConfigured()).thenReturn(true);
        when(secondarySource.searchShopping(anyString(), any(), anyString())).thenReturn(Mono.error(new IllegalStateException("down")));

        StepVerifier.create(orchestrator.aggregate(new AggregationRequest("oat milk", "60622", List.of("aldi"), false)))
            .assertNext(response -> {
                assertThat(response.storesConsidered()).containsExactly("aldi");
                assertThat(response.results()).isEmpty();
            })
            .verifyComplete();

        verify(secondarySource, times(1)).searchShopping(eq("oat milk"), eq(new StoreRef("aldi", "Aldi")), eq("United States"));
    }

    @Test
    @DisplayName("a store whose primary call times out still gets a full budget for shopping search")
    void aggregate_secondaryHasItsOwnTimeoutAfterPrimaryTimesOut() {
        ProductRecord shoppingRow = new ProductRecord("Kroger Oat Milk", null, PriceValue.of(3.49), null, null,
            "In Stock", null, null, null, null);
        when(secondarySource.isConfigured()).thenReturn(true);
        when(secondarySource.searchShopping(eq("oat milk"), eq(new StoreRef("kroger", "Kroger")), eq("United States")))
            .thenReturn(Mono.just(List.of(shoppingRow)).delayElement(Duration.ofMillis(150)));

        StepVerifier.create(orchestrator.aggregate(new AggregationRequest("oat milk", "60622", List.of("kroger"), false)))
            .assertNext(response -> assertThat(response.results()).singleElement()
                .satisfies(group -> assertThat(group.offers()).extracting(OfferView::storeId).containsExactly("kroger")))
            .verifyComplete();
    }

    @Test
    @DisplayName("a primary answer saying no products were found sends the store to shopping search")
    void aggregate_usesSecondaryWhenPrimaryReportsNoProducts() {
        when(primarySource.query(anyString())).thenReturn(Mono.just(RawSourceResponse.textOnly(
            "No products found for oat milk at Whole Foods Market in 60622.")));
        ProductRecord shoppingRow = new ProductRecord("Silk Original Oat Milk", null, PriceValue.of(5.49), null, null,
            "In Stock", null, null, "https://www.wholefoodsmarket.com/product/silk-oat", null);
        when(secondarySource.isConfigured()).thenReturn(true);
        when(secondarySource.searchShopping(eq("oat milk"), eq(new StoreRef("whole_foods", "Whole Foods Market")),
            eq("United States"))).thenReturn(Mono.just(List.of(shoppingRow)));

        StepVerifier.create(orchestrator.aggregate(new AggregationRequest("oat milk", "60622", List.of("whole_foods"), false)))
            .assertNext(response -> {
                assertThat(response.source()).isEqualTo(ProductAggregationOrchestrator.SOURCE_WITH_SECONDARY);
                assertThat(response.results()).singleElement().satisfies(group -> {
                    assertThat(group.canonicalProduct().name()).isEqualTo("Silk Original Oat Milk");
                    assertThat(group.offers()).singleElement()
                        .satisfies(offer -> assertThat(offer.source()).containsExactly(SourceTag.SERPER_SHOPPING));
                });
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("an allowlist is lowercased, deduplicated and truncated to ten stores in caller order")
    void aggregate_capsAllowlist() {
        when(secondarySource.isConfigured()).thenReturn(false);
        List<String> requested = new ArrayList<>(List.of("Target", "target"));
        IntStream.rangeClosed(1, 11).forEach(i -> requested.add("store_" + i));

        AggregationResponse response = orchestrator.aggregate(
            new AggregationRequest("oat milk", "60622", requested, false)).block();

        assertThat(response).isNotNull();
        assertThat(response.storesConsidered()).hasSize(10);
        assertThat(response.storesConsidered()).startsWith("target", "store_1", "store_2").endsWith("store_9");
        verifyNoInteractions(storeDiscovery);
    }

    @Test
    void aggregate_discoversStoresWhenNoAllowlistGiven() {
        when(secondarySource.isConfigured()).thenReturn(false);
        List<StoreRecord> nearby = IntStream.rangeClosed(1, 12)
            .mapToObj(i -> new StoreRecord("chain_" + i, "Chain " + i, null, null, null, null))
            .toList();
        when(storeDiscovery.getNearbyStores("60622"))
            .thenReturn(Mono.just(new StoreDiscoveryResponse("60622", nearby, StoreDiscoveryService.SOURCE_PRIMARY, CacheStatus.miss())));

        StepVerifier.create(orchestrator.aggregate(new AggregationRequest("oat milk", "60622", List.of(), false)))
            .assertNext(response -> assertThat(response.storesConsidered()).hasSize(10).startsWith("chain_1").endsWith("chain_10"))
            .verifyComplete();
    }

    @Test
    @DisplayName("a repeated request is served from cache and flagged near-stale close to expiry")
    void aggregate_servesRepeatFromCache() {
        AggregationRequest request = new AggregationRequest("Oat Milk", "60622", List.of("target"), false);

        AggregationResponse first = orchestrator.aggregate(request).block();
        AggregationResponse second = orchestrator.aggregate(
            new AggregationRequest("  oat milk ", "60622", List.of("TARGET"), false)).block();
        ticker.advance(Duration.ofHours(3).plusMinutes(30));
        AggregationResponse third = orchestrator.aggregate(request).block();

        assertThat(first.cache().hit()).isFalse();
        assertThat(second.cache()).isEqualTo(new CacheStatus(true, false));
        assertThat(second.results()).isEqualTo(first.results());
        assertThat(third.cache()).isEqualTo(new CacheStatus(true, true));
        verify(primarySource, times(1)).query(anyString());
    }

    @Test
    void aggregate_returnsResultWhenCacheWriteFails() {
        CacheStore failingStore = mock(CacheStore.class);
        when(failingStore.get(anyString())).thenReturn(Optional.empty());
        doThrow(new CacheOperationException("k", "put", new IOException("disk full")))
            .when(failingStore).put(anyString(), any(), any());

        StepVerifier.create(orchestrator(failingStore).aggregate(
                new AggregationRequest("oat milk", "60622", List.of("target"), false)))
            .assertNext(response -> assertThat(response.results()).hasSize(2))
            .verifyComplete();
    }

    @Test
    void aggregate_rejectsInvalidInputBeforeAnyIo() {
        assertThatThrownBy(() -> orchestrator.aggregate(new AggregationRequest("oat milk", "6062", List.of(), false)))
            .isInstanceOf(InvalidAggregationRequestException.class);
        assertThatThrownBy(() -> orchestrator.aggregate(new AggregationRequest("  ", "60622", List.of(), false)))
            .isInstanceOf(InvalidAggregationRequestException.class);
        verify(primarySource, never()).query(anyString());
        verifyNoInteractions(storeDiscovery);
    }

    @Test
    void aggregate_signalsMissingPrimaryCredentials() {
        when(primarySource.isConfigured()).thenReturn(false);

        StepVerifier.create(orchestrator.aggregate(new AggregationRequest("oat milk", "60622", List.of("target"), false)))
            .expectError(SourceNotConfiguredException.class)
            .verify();
    }

    @Test
    void searchStore_returnsParsedProductsAndAbsorbsFailures() {
        StepVerifier.create(orchestrator.searchStore("oat milk", "Target", "60622", false))
            .assertNext(response -> {
                assertThat(response.storeName()).isEqualTo("Target");
                assertThat(response.products()).extracting(ProductRecord::name).containsExactly("Oatly Original", "Silk Original");
            })
            .verifyComplete();

        StepVerifier.create(orchestrator.searchStore("oat milk", "Kroger", "60622", false))
            .assertNext(response -> assertThat(response.products()).isEmpty())
            .verifyComplete();
    }

    private ProductAggregationOrchestrator orchestrator(CacheStore store) {
        AggregationCache cache = new AggregationCache(store, new JsonPayloadCodec(new ObjectMapper()));
        StoreProductSearchService productSearch =
            new StoreProductSearchService(primarySource, new TextRecordParser(), new CitationUrlEnricher());
        return new ProductAggregationOrchestrator(primarySource, secondarySource, productSearch, storeDiscovery,
            new OfferGrouper(), cache, properties);
    }

    private static ProductGroup group(AggregationResponse response, String groupKey) {
        return response.results().stream()
            .filter(g -> g.groupKey().equals(groupKey))
            .findFirst()
            .orElseThrow();
    }
}
