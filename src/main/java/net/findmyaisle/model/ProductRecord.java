package net.findmyaisle.model;

import java.util.Locale;

/**
 * A product recovered from a source answer or a shopping result row.
 * Only {@code name} is guaranteed to be present.
 */
public record ProductRecord(String name,
                            String brand,
                            PriceValue price,
                            String size,
                            String category,
                            String availability,
                            String description,
                            String imageUrl,
                            String productUrl,
                            String deals) implements ParsedRecord {

    @Override
    public String dedupeKey() {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public boolean hasBrandAndSize() {
        return brand != null && !brand.isBlank() && size != null && !size.isBlank();
    }

    public ProductRecord withProductUrl(String url) {
        return new ProductRecord(name, brand, price, size, category, availability, description, imageUrl, url, deals);
    }

    public ProductRecord withImageUrl(String url) {
        return new ProductRecord(name, brand, price, size, category, availability, description, url, productUrl, deals);
    }
}
