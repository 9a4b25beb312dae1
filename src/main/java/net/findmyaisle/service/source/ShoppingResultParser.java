package net.findmyaisle.service.source;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.model.PriceValue;
import net.findmyaisle.model.ProductRecord;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps {@code shopping[]} rows of a shopping-search response to product records.
 */
@Slf4j
final class ShoppingResultParser {

    static final String DEFAULT_AVAILABILITY = "In Stock";

    private static final Pattern PRICE_NUMBER = Pattern.compile("\\d+\\.?\\d*");

    private ShoppingResultParser() {
    }

    /**
     * @param body response body
     * @param expectedDomain when present, rows whose link host does not contain it are dropped
     */
    static List<ProductRecord> parse(JsonNode body, String expectedDomain) {
        List<ProductRecord> products = new ArrayList<>();
        if (body == null) {
            return products;
        }
        JsonNode rows = body.path("shopping");
        if (!rows.isArray()) {
            return products;
        }
        for (JsonNode row : rows) {
            String title = row.path("title").asString(null);
            if (!StringUtils.hasText(title)) {
                continue;
            }
            String link = emptyToNull(row.path("link").asString(null));
            if (StringUtils.hasText(expectedDomain) && !hostContains(link, expectedDomain)) {
                continue;
            }
            products.add(new ProductRecord(
                title.trim(),
                null,
                parsePrice(row.path("price").asString(null)),
                null,
                null,
                DEFAULT_AVAILABILITY,
                null,
                emptyToNull(row.path("imageUrl").asString(null)),
                link,
                null));
        }
        return products;
    }

    static PriceValue parsePrice(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        Matcher matcher = PRICE_NUMBER.matcher(raw.replace(",", ""));
        if (!matcher.find()) {
            return null;
        }
        return PriceValue.of(Double.parseDouble(matcher.group()));
    }

    private static boolean hostContains(String link, String domain) {
        if (link == null) {
            return false;
        }
        try {
            String host = UriComponentsBuilder.fromUriString(link).build().getHost();
            return host != null && host.toLowerCase(Locale.ROOT).contains(domain.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            log.debug("Dropping shopping row with unparseable link {}", link);
            return false;
        }
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
