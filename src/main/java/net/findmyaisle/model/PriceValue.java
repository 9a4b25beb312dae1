package net.findmyaisle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A price as reported by a source: a dollar amount when one could be read,
 * otherwise the raw text (e.g. "Price not available"). Serialized as a JSON
 * number or string accordingly.
 */
public record PriceValue(Double amount, String text) {

    private static final Pattern DOLLAR_AMOUNT = Pattern.compile("\\$(\\d+(?:\\.\\d+)?)");

    /**
     * Reads the first {@code $<digits>[.digits]} in the text.
     *
     * @return numeric price, raw-text price when no amount is present, or {@code null} for blank input
     */
    public static PriceValue parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher matcher = DOLLAR_AMOUNT.matcher(raw);
        if (matcher.find()) {
            return of(Double.parseDouble(matcher.group(1)));
        }
        return new PriceValue(null, raw.trim());
    }

    public static PriceValue of(double amount) {
        return new PriceValue(amount, null);
    }

    public boolean isNumeric() {
        return amount != null;
    }

    @JsonValue
    public Object jsonValue() {
        return amount != null ? amount : text;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static PriceValue fromJson(Object value) {
        if (value instanceof Number number) {
            return of(number.doubleValue());
        }
        return value == null ? null : new PriceValue(null, value.toString());
    }
}
