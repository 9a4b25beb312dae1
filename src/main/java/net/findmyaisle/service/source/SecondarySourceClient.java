package net.findmyaisle.service.source;

import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.StoreRef;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Shopping-search source returning already structured rows, used when the primary
 * source finds nothing for a store.
 */
public interface SecondarySourceClient {

    String name();

    boolean isConfigured();

    /**
     * @param query product query as typed by the user
     * @param store store whose offers are wanted; its domain scopes and filters the search when known
     * @param locationHint free-text location, e.g. a country name
     * @return product rows, empty when nothing matched
     */
    Mono<List<ProductRecord>> searchShopping(String query, StoreRef store, String locationHint);
}
