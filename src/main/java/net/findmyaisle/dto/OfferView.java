package net.findmyaisle.dto;

import net.findmyaisle.model.PriceValue;
import net.findmyaisle.model.SourceTag;

import java.util.List;

public record OfferView(String storeId,
                        String storeName,
                        PriceValue price,
                        String availability,
                        String productUrl,
                        List<SourceTag> source) {
}
