package net.findmyaisle.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One store's price, availability and link for a canonical product.
 */
public record Offer(String storeId,
                    String storeName,
                    PriceValue price,
                    String availability,
                    String productUrl,
                    String imageUrl,
                    Set<SourceTag> sourceTags) {

    public Offer {
        sourceTags = sourceTags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(sourceTags));
    }

    public static Offer from(StoreRef store, ProductRecord product, SourceTag source) {
        return new Offer(store.storeId(), store.storeName(), product.price(), product.availability(),
            product.productUrl(), product.imageUrl(), Set.of(source));
    }
}
