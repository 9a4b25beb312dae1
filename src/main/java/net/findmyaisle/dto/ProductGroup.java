package net.findmyaisle.dto;

import java.util.List;

/**
 * A canonical product and its per-store offers as returned to callers and cached.
 */
public record ProductGroup(String groupKey, ProductSummary canonicalProduct, List<OfferView> offers) {
}
