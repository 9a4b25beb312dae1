package net.findmyaisle.controller;

import net.findmyaisle.dto.StoreDiscoveryResponse;
import net.findmyaisle.model.StoreRecord;
import net.findmyaisle.service.StoreDiscoveryService;
import net.findmyaisle.util.SearchQueryUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/stores")
public class StoreController {

    private final StoreDiscoveryService storeDiscoveryService;

    public StoreController(StoreDiscoveryService storeDiscoveryService) {
        this.storeDiscoveryService = storeDiscoveryService;
    }

    /**
     * Stores near a postal code. {@code chains} narrows the response to stores whose id
     * or name contains one of the listed chain names; the cached discovery result is unaffected.
     */
    @GetMapping("/{postalCode}")
    public Mono<ResponseEntity<StoreDiscoveryResponse>> nearbyStores(@PathVariable String postalCode,
                                                                     @RequestParam(required = false) String chains) {
        List<String> chainFilter = SearchQueryUtils.parseStoreList(chains);
        return storeDiscoveryService.getNearbyStores(postalCode)
            .map(response -> chainFilter.isEmpty() ? response : filterChains(response, chainFilter))
            .map(ResponseEntity::ok);
    }

    private static StoreDiscoveryResponse filterChains(StoreDiscoveryResponse response, List<String> chains) {
        List<StoreRecord> stores = response.stores().stream()
            .filter(store -> matchesAny(store, chains))
            .toList();
        return new StoreDiscoveryResponse(response.postalCode(), stores, response.source(), response.cache());
    }

    private static boolean matchesAny(StoreRecord store, List<String> chains) {
        String id = store.storeId();
        String name = store.storeName() == null ? "" : store.storeName().toLowerCase(Locale.ROOT);
        return chains.stream().anyMatch(chain -> id.contains(chain) || name.contains(chain));
    }
}
