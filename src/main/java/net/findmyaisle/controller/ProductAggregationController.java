package net.findmyaisle.controller;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.dto.AggregationRequest;
import net.findmyaisle.dto.AggregationResponse;
import net.findmyaisle.dto.StoreProductsResponse;
import net.findmyaisle.service.ProductAggregationOrchestrator;
import net.findmyaisle.util.SearchQueryUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Product search endpoints.
 */
@RestController
@RequestMapping("/api/products")
@Slf4j
public class ProductAggregationController {

    private final ProductAggregationOrchestrator orchestrator;

    public ProductAggregationController(ProductAggregationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Canonical products with per-store offers for a query near a postal code.
     *
     * @param stores optional comma separated store ids; discovery is used when absent
     * @param zipcode accepted as an alias of {@code postalCode}
     */
    @GetMapping("/aggregate")
    public Mono<ResponseEntity<AggregationResponse>> aggregate(@RequestParam String query,
                                                               @RequestParam(required = false) String postalCode,
                                                               @RequestParam(required = false) String zipcode,
                                                               @RequestParam(required = false) String stores,
                                                               @RequestParam(defaultValue = "false") boolean enhance) {
        AggregationRequest request = new AggregationRequest(query, firstNonBlank(postalCode, zipcode),
            SearchQueryUtils.parseStoreList(stores), enhance);
        log.debug("Aggregate request: query='{}', postalCode={}, stores={}, enhance={}",
            query, request.postalCode(), request.storeIds(), enhance);
        return orchestrator.aggregate(request).map(ResponseEntity::ok);
    }

    /**
     * Raw parsed products for one named store.
     */
    @GetMapping("/search")
    public Mono<ResponseEntity<StoreProductsResponse>> searchStore(@RequestParam String query,
                                                                   @RequestParam String storeName,
                                                                   @RequestParam(required = false) String postalCode,
                                                                   @RequestParam(required = false) String zipcode,
                                                                   @RequestParam(defaultValue = "false") boolean enhance) {
        return orchestrator.searchStore(query, storeName, firstNonBlank(postalCode, zipcode), enhance)
            .map(ResponseEntity::ok);
    }

    private static String firstNonBlank(String preferred, String alias) {
        return StringUtils.hasText(preferred) ? preferred : alias;
    }
}
