package net.findmyaisle.service;

import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.RawSourceResponse;
import net.findmyaisle.model.RelatedResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CitationUrlEnricherTest {

    private static final String TARGET_URL = "https://www.target.com/p/silk-original-oat-milk-59-fl-oz/-/A-54321?preselect=1";
    private static final String WALMART_URL = "https://www.walmart.com/ip/Oatly-Barista-Edition-Oatmilk-32-oz/987654";

    private final CitationUrlEnricher enricher = new CitationUrlEnricher();

    @Test
    void enrich_attachesBestMatchingRetailerUrl() {
        RawSourceResponse response = new RawSourceResponse("...", List.of(TARGET_URL, "https://news.example.com/oat"),
            List.of(new RelatedResult(WALMART_URL, "Oatly")));

        List<ProductRecord> enriched = enricher.enrich(List.of(
            product("Silk Original Oat Milk", null),
            product("Oatly Barista Edition", null),
            product("Chobani Greek Yogurt", null)), response, false);

        assertThat(enriched).extracting(ProductRecord::productUrl)
            .containsExactly(TARGET_URL, WALMART_URL, null);
        assertThat(enriched).extracting(ProductRecord::imageUrl).containsOnlyNulls();
    }

    @Test
    void enrich_derivesRetailerImagesOnlyWhenAsked() {
        RawSourceResponse response = new RawSourceResponse("...", List.of(TARGET_URL, WALMART_URL), List.of());

        List<ProductRecord> enriched = enricher.enrich(List.of(
            product("Silk Original Oat Milk", null),
            product("Oatly Barista Edition", "https://cdn.example.com/oatly.png")), response, true);

        assertThat(enriched.get(0).imageUrl())
            .isEqualTo("https://target.scene7.com/is/image/Target/54321?wid=1200&hei=1200&qlt=80&fmt=webp");
        assertThat(enriched.get(1).imageUrl()).isEqualTo("https://cdn.example.com/oatly.png");
    }

    @Test
    void enrich_keepsExistingProductUrl() {
        ProductRecord withUrl = product("Silk Original Oat Milk", null).withProductUrl("https://shop.example.com/silk");
        RawSourceResponse response = new RawSourceResponse("...", List.of(TARGET_URL), List.of());

        assertThat(enricher.enrich(List.of(withUrl), response, false).get(0).productUrl())
            .isEqualTo("https://shop.example.com/silk");
    }

    @Test
    void productNameFromUrl_readsRetailerSlugs() {
        assertThat(CitationUrlEnricher.productNameFromUrl(TARGET_URL)).isEqualTo("silk original oat milk 59 fl oz");
        assertThat(CitationUrlEnricher.productNameFromUrl(WALMART_URL)).isEqualTo("Oatly Barista Edition Oatmilk 32 oz");
        assertThat(CitationUrlEnricher.productNameFromUrl("https://www.amazon.com/dp/B0ABC123")).isEqualTo("amazon product B0ABC123");
        assertThat(CitationUrlEnricher.productNameFromUrl("https://example.com/silk")).isEmpty();
    }

    @Test
    void retailerImageFor_buildsWalmartImageFromItemId() {
        assertThat(CitationUrlEnricher.retailerImageFor(WALMART_URL))
            .contains("https://i5.walmartimages.com/asr/987654.jpeg");
        assertThat(CitationUrlEnricher.retailerImageFor("https://www.amazon.com/dp/B0ABC123")).isEmpty();
    }

    @Test
    void bestMatch_requiresOverlapAboveThreshold() {
        Map<String, String> urls = Map.of("silk original oat milk", TARGET_URL);

        assertThat(CitationUrlEnricher.bestMatch("Silk Soy Creamer Vanilla", urls)).isEmpty();
        assertThat(CitationUrlEnricher.bestMatch("Silk Oat Milk", urls)).contains(TARGET_URL);
    }

    private static ProductRecord product(String name, String imageUrl) {
        return new ProductRecord(name, null, null, null, null, null, null, imageUrl, null, null);
    }
}
