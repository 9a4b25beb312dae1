package net.findmyaisle.service;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.RecordKind;
import net.findmyaisle.service.source.PrimarySourceClient;
import net.findmyaisle.service.source.SourcePrompts;
import net.findmyaisle.support.parsing.TextRecordParser;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asks the primary source about one store and turns the answer into products with
 * retailer links attached. Source failures are passed through to the caller.
 */
@Slf4j
@Service
public class StoreProductSearchService {

    private final PrimarySourceClient primarySource;
    private final TextRecordParser parser;
    private final CitationUrlEnricher urlEnricher;

    public StoreProductSearchService(PrimarySourceClient primarySource,
                                     TextRecordParser parser,
                                     CitationUrlEnricher urlEnricher) {
        this.primarySource = primarySource;
        this.parser = parser;
        this.urlEnricher = urlEnricher;
    }

    public Mono<List<ProductRecord>> searchProducts(String query, String storeName, String location, boolean enhance) {
        return primarySource.query(SourcePrompts.productPrompt(query, storeName, location))
            .map(response -> {
                List<ProductRecord> products = parser.parse(response.text(), RecordKind.PRODUCT).stream()
                    .filter(ProductRecord.class::isInstance)
                    .map(ProductRecord.class::cast)
                    .toList();
                log.debug("Parsed {} product(s) for '{}' at {}", products.size(), query, storeName);
                return urlEnricher.enrich(products, response, enhance);
            });
    }
}
