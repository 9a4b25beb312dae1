package net.findmyaisle.model;

import java.util.List;
import java.util.Set;

/**
 * Offers from any store or source that share a normalized brand, name and size.
 * The first offer seen supplies the display fields.
 */
public record CanonicalProduct(String groupKey,
                               String displayName,
                               String brand,
                               String size,
                               Set<String> images,
                               List<Offer> offers) {
}
