package net.findmyaisle.support.parsing;

import net.findmyaisle.model.ParsedRecord;
import net.findmyaisle.model.PriceValue;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.RecordKind;
import net.findmyaisle.model.StoreRecord;
import net.findmyaisle.util.SlugGenerator;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects field values for one in-progress record and materializes it once the
 * section closes.
 */
final class RecordAssembler {

    static final Set<String> KNOWN_SERVICES = Set.of("delivery", "pickup", "curbside", "in-store", "online");

    private final RecordKind kind;
    private final Map<RecordField, String> values = new EnumMap<>(RecordField.class);
    private String recoveredImageUrl;

    RecordAssembler(RecordKind kind) {
        this.kind = kind;
    }

    boolean hasPrimary() {
        return values.containsKey(RecordField.primaryFor(kind));
    }

    /** Placeholder echoes and "N/A" style answers are ignored. */
    void set(RecordField field, String value) {
        if (field.isAbsent(value)) {
            return;
        }
        values.put(field, value.trim());
    }

    /** Keeps the first bare image URL seen; an explicit IMAGE_URL value always wins. */
    void offerImageUrl(String url) {
        if (recoveredImageUrl == null && !values.containsKey(RecordField.IMAGE_URL)) {
            recoveredImageUrl = url;
        }
    }

    Optional<ParsedRecord> build() {
        if (!hasPrimary()) {
            return Optional.empty();
        }
        if (kind == RecordKind.PRODUCT) {
            return Optional.of(buildProduct());
        }
        String storeId = SlugGenerator.storeId(values.get(RecordField.STORE));
        return storeId.isEmpty() ? Optional.empty() : Optional.of(buildStore(storeId));
    }

    private StoreRecord buildStore(String storeId) {
        String storeName = values.get(RecordField.STORE);
        return new StoreRecord(
            storeId,
            storeName,
            values.get(RecordField.ADDRESS),
            parseServices(values.get(RecordField.SERVICES)),
            values.get(RecordField.WEBSITE),
            values.get(RecordField.STATUS));
    }

    private ProductRecord buildProduct() {
        String imageUrl = values.getOrDefault(RecordField.IMAGE_URL, recoveredImageUrl);
        return new ProductRecord(
            values.get(RecordField.PRODUCT),
            values.get(RecordField.BRAND),
            PriceValue.parse(values.get(RecordField.PRICE)),
            values.get(RecordField.SIZE),
            values.get(RecordField.CATEGORY),
            values.get(RecordField.AVAILABILITY),
            values.get(RecordField.DESCRIPTION),
            imageUrl,
            null,
            values.get(RecordField.DEALS));
    }

    private static Set<String> parseServices(String raw) {
        Set<String> services = new LinkedHashSet<>();
        if (raw == null) {
            return services;
        }
        for (String part : raw.split(",")) {
            String service = part.trim().toLowerCase(Locale.ROOT);
            if (KNOWN_SERVICES.contains(service)) {
                services.add(service);
            }
        }
        return services;
    }
}
