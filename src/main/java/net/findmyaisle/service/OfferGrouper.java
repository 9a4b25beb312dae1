package net.findmyaisle.service;

import net.findmyaisle.model.CanonicalProduct;
import net.findmyaisle.model.Offer;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.util.NameSimilarity;
import net.findmyaisle.util.ProductNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges store product hits into canonical products keyed by
 * {@link ProductNormalizer#groupKey(String, String, String)}.
 *
 * <p>Hits that carry both brand and size are grouped first. Hits missing either
 * (typically shopping rows) then join the best-matching complete group whose brand
 * appears in their name and whose name overlaps theirs by more than
 * {@link NameSimilarity#MATCH_THRESHOLD}; otherwise they are grouped by their own key.
 * The match is decided once per key, so loose hits with equal keys always share a group.</p>
 */
@Component
public class OfferGrouper {

    public List<CanonicalProduct> group(List<StoreProductHit> hits) {
        Map<String, GroupBuilder> groups = new LinkedHashMap<>();
        List<StoreProductHit> loose = new ArrayList<>();

        for (StoreProductHit hit : hits) {
            if (hit.product().hasBrandAndSize()) {
                groupFor(groups, hit.product()).add(hit);
            } else {
                loose.add(hit);
            }
        }

        List<GroupBuilder> complete = new ArrayList<>(groups.values());
        // The first loose hit seen for a key decides where every hit with that key goes.
        Map<String, GroupBuilder> looseTargets = new LinkedHashMap<>();
        for (StoreProductHit hit : loose) {
            ProductRecord product = hit.product();
            String looseKey = ProductNormalizer.groupKey(product.brand(), product.name(), product.size());
            GroupBuilder target = looseTargets.computeIfAbsent(looseKey, k -> {
                GroupBuilder match = bestCompleteMatch(complete, product);
                return match != null ? match : groupFor(groups, product);
            });
            target.add(hit);
        }

        List<CanonicalProduct> products = new ArrayList<>(groups.size());
        for (GroupBuilder builder : groups.values()) {
            products.add(builder.build());
        }
        return products;
    }

    private static GroupBuilder groupFor(Map<String, GroupBuilder> groups, ProductRecord product) {
        String key = ProductNormalizer.groupKey(product.brand(), product.name(), product.size());
        return groups.computeIfAbsent(key, k -> new GroupBuilder(k, product));
    }

    private static GroupBuilder bestCompleteMatch(List<GroupBuilder> candidates, ProductRecord product) {
        String name = ProductNormalizer.normText(product.name());
        GroupBuilder best = null;
        double bestScore = 0;
        for (GroupBuilder candidate : candidates) {
            String brand = ProductNormalizer.normText(candidate.brand);
            if (brand.isEmpty() || !name.contains(brand)) {
                continue;
            }
            double score = NameSimilarity.wordOverlap(product.name(), candidate.displayName);
            if (score > NameSimilarity.MATCH_THRESHOLD && score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    private static final class GroupBuilder {
        private final String groupKey;
        private final String displayName;
        private final String brand;
        private final String size;
        private final Set<String> images = new LinkedHashSet<>();
        private final List<Offer> offers = new ArrayList<>();

        private GroupBuilder(String groupKey, ProductRecord first) {
            this.groupKey = groupKey;
            this.displayName = first.name();
            this.brand = first.brand();
            this.size = first.size();
        }

        void add(StoreProductHit hit) {
            String imageUrl = hit.product().imageUrl();
            if (imageUrl != null && !imageUrl.isBlank()) {
                images.add(imageUrl);
            }
            offers.add(Offer.from(hit.store(), hit.product(), hit.source()));
        }

        CanonicalProduct build() {
            return new CanonicalProduct(groupKey, displayName, brand, size,
                Collections.unmodifiableSet(new LinkedHashSet<>(images)), List.copyOf(offers));
        }
    }
}
