package net.findmyaisle.service;

import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.SourceTag;
import net.findmyaisle.model.StoreRef;

/**
 * A product found at one store by one source, before grouping.
 */
public record StoreProductHit(StoreRef store, ProductRecord product, SourceTag source) {
}
