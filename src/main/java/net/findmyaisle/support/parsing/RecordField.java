package net.findmyaisle.support.parsing;

import net.findmyaisle.model.RecordKind;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Field markers understood in source answers, with the template placeholder each
 * one is requested with. A value equal to its placeholder means the source echoed
 * the template without filling it in.
 */
public enum RecordField {
    STORE(RecordKind.STORE, "[Store Name]"),
    ADDRESS(RecordKind.STORE, "[Complete street address with city, state, zip]"),
    SERVICES(RecordKind.STORE, "[comma-separated list: delivery, pickup, curbside, in-store]"),
    WEBSITE(RecordKind.STORE, "[full URL if available, or \"N/A\"]", "N/A"),
    STATUS(RecordKind.STORE, "[open/closed/temporarily closed]"),

    PRODUCT(RecordKind.PRODUCT, "[Product Name]"),
    BRAND(RecordKind.PRODUCT, "[Brand Name]"),
    PRICE(RecordKind.PRODUCT, "[Price with $ symbol, or \"Price not available\"]"),
    SIZE(RecordKind.PRODUCT, "[Size/quantity, e.g., \"32 oz\", \"1 gallon\", \"12 pack\"]"),
    CATEGORY(RecordKind.PRODUCT, "[Product category, e.g., \"Dairy\", \"Beverages\", \"Organic\"]"),
    AVAILABILITY(RecordKind.PRODUCT, "[in stock/out of stock/limited]"),
    DESCRIPTION(RecordKind.PRODUCT, "[Brief product description]"),
    IMAGE_URL(RecordKind.PRODUCT, "[Actual product image URL from store website, or \"N/A\" if not found]", "N/A"),
    DEALS(RecordKind.PRODUCT, "[Any current deals, discounts, or \"None\"]");

    private final RecordKind kind;
    private final String placeholder;
    private final Set<String> absentValues;

    RecordField(RecordKind kind, String placeholder, String... absentValues) {
        this.kind = kind;
        this.placeholder = placeholder;
        this.absentValues = Set.of(absentValues);
    }

    public String placeholder() {
        return placeholder;
    }

    /** The {@code KEY:} marker that starts a line carrying this field. */
    public String marker() {
        return name() + ":";
    }

    public boolean isPrimary() {
        return this == STORE || this == PRODUCT;
    }

    /**
     * True for blank values, the field's own placeholder, and field-specific
     * "nothing found" answers such as {@code N/A}.
     */
    public boolean isAbsent(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        String trimmed = value.trim();
        if (trimmed.equals(placeholder)) {
            return true;
        }
        return absentValues.stream().anyMatch(trimmed::equalsIgnoreCase);
    }

    public static List<RecordField> fieldsFor(RecordKind kind) {
        return Arrays.stream(values()).filter(field -> field.kind == kind).toList();
    }

    public static RecordField primaryFor(RecordKind kind) {
        return kind == RecordKind.STORE ? STORE : PRODUCT;
    }

    /**
     * Finds the field whose marker starts the line. Markers are matched case-sensitively.
     */
    public static Optional<RecordField> matchLine(RecordKind kind, String line) {
        if (line == null) {
            return Optional.empty();
        }
        return fieldsFor(kind).stream()
            .filter(field -> line.startsWith(field.marker()))
            .findFirst();
    }
}
