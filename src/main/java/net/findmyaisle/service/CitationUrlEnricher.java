package net.findmyaisle.service;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.RawSourceResponse;
import net.findmyaisle.model.RelatedResult;
import net.findmyaisle.util.NameSimilarity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Attaches real retailer product links to parsed products by matching the product
 * name against the name implied by cited URLs ({@code target.com/p/},
 * {@code walmart.com/ip/}, {@code amazon.com/dp/}).
 */
@Slf4j
@Component
public class CitationUrlEnricher {

    private static final String TARGET_PATH = "target.com/p/";
    private static final String WALMART_PATH = "walmart.com/ip/";
    private static final String AMAZON_PATH = "amazon.com/dp/";

    /**
     * @param products parsed products, left untouched when no URL matches
     * @param response the answer the products were parsed from
     * @param deriveImages when true, products still lacking an image get one derived from a matched Target/Walmart URL
     * @return products in the same order, possibly with {@code productUrl}/{@code imageUrl} filled in
     */
    public List<ProductRecord> enrich(List<ProductRecord> products, RawSourceResponse response, boolean deriveImages) {
        Map<String, String> urlsByName = retailerUrlsByName(response);
        if (urlsByName.isEmpty() || products.isEmpty()) {
            return products;
        }
        List<ProductRecord> enriched = new ArrayList<>(products.size());
        for (ProductRecord product : products) {
            enriched.add(bestMatch(product.name(), urlsByName)
                .map(url -> attach(product, url, deriveImages))
                .orElse(product));
        }
        return enriched;
    }

    private ProductRecord attach(ProductRecord product, String url, boolean deriveImages) {
        ProductRecord updated = product.productUrl() == null ? product.withProductUrl(url) : product;
        if (deriveImages && updated.imageUrl() == null) {
            Optional<String> image = retailerImageFor(url);
            if (image.isPresent()) {
                updated = updated.withImageUrl(image.get());
            }
        }
        return updated;
    }

    static Optional<String> bestMatch(String productName, Map<String, String> urlsByName) {
        String best = null;
        double bestScore = 0;
        for (Map.Entry<String, String> entry : urlsByName.entrySet()) {
            double score = NameSimilarity.wordOverlap(productName, entry.getKey());
            if (score > bestScore && score > NameSimilarity.MATCH_THRESHOLD) {
                bestScore = score;
                best = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    static Map<String, String> retailerUrlsByName(RawSourceResponse response) {
        Map<String, String> urls = new LinkedHashMap<>();
        List<String> candidates = new ArrayList<>(response.citations());
        for (RelatedResult result : response.relatedResults()) {
            candidates.add(result.url());
        }
        for (String url : candidates) {
            String name = productNameFromUrl(url);
            if (!name.isEmpty()) {
                urls.put(name.toLowerCase(Locale.ROOT), url);
            }
        }
        log.debug("Found {} retailer product URL(s) among {} citation(s)", urls.size(), candidates.size());
        return urls;
    }

    /**
     * Target: {@code /p/<slug>/-/A-<id>}; Walmart: {@code /ip/<slug>/<id>}; Amazon: {@code /dp/<asin>}.
     */
    static String productNameFromUrl(String url) {
        if (url == null) {
            return "";
        }
        if (url.contains(TARGET_PATH)) {
            return slugWords(afterMarker(url, "/p/").split("/-/")[0]);
        }
        if (url.contains(WALMART_PATH)) {
            return slugWords(afterMarker(url, "/ip/").split("/")[0]);
        }
        if (url.contains(AMAZON_PATH)) {
            String asin = afterMarker(url, "/dp/").split("/")[0];
            return asin.isEmpty() ? "" : "amazon product " + asin;
        }
        return "";
    }

    static Optional<String> retailerImageFor(String url) {
        if (url.contains("target.com") && url.contains("/A-")) {
            String id = afterMarker(url, "/A-").split("[/?#]")[0];
            if (!id.isEmpty()) {
                return Optional.of("https://target.scene7.com/is/image/Target/" + id + "?wid=1200&hei=1200&qlt=80&fmt=webp");
            }
        }
        if (url.contains(WALMART_PATH)) {
            String[] segments = afterMarker(url, "/ip/").split("/");
            if (segments.length > 1) {
                String id = segments[1].split("[?#]")[0];
                if (!id.isEmpty()) {
                    return Optional.of("https://i5.walmartimages.com/asr/" + id + ".jpeg");
                }
            }
        }
        return Optional.empty();
    }

    private static String afterMarker(String url, String marker) {
        int index = url.indexOf(marker);
        return index < 0 ? "" : url.substring(index + marker.length());
    }

    private static String slugWords(String slug) {
        return slug.split("[?#]")[0].replace('-', ' ').trim();
    }
}
