package net.findmyaisle.dto;

import net.findmyaisle.model.CanonicalProduct;
import net.findmyaisle.model.Offer;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps grouped domain products onto their wire shape.
 */
public final class AggregationDtoMapper {

    private AggregationDtoMapper() {
    }

    public static List<ProductGroup> toGroups(List<CanonicalProduct> products) {
        List<ProductGroup> groups = new ArrayList<>(products.size());
        for (CanonicalProduct product : products) {
            groups.add(toGroup(product));
        }
        return groups;
    }

    public static ProductGroup toGroup(CanonicalProduct product) {
        ProductSummary summary = new ProductSummary(product.displayName(), product.brand(), product.size(),
            List.copyOf(product.images()));
        List<OfferView> offers = product.offers().stream()
            .map(AggregationDtoMapper::toView)
            .toList();
        return new ProductGroup(product.groupKey(), summary, offers);
    }

    private static OfferView toView(Offer offer) {
        return new OfferView(offer.storeId(), offer.storeName(), offer.price(), offer.availability(),
            offer.productUrl(), List.copyOf(offer.sourceTags()));
    }
}
