package net.findmyaisle.support.parsing;

import net.findmyaisle.model.ParsedRecord;
import net.findmyaisle.model.PriceValue;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.RecordKind;
import net.findmyaisle.model.StoreRecord;
import net.findmyaisle.util.SlugGenerator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loose keyword scan used when an answer does not follow the requested field layout.
 * Stores are recognized from a catalog of chain names; products from brand/category
 * keywords plus price, size and availability cues on nearby lines.
 */
final class FallbackRecordScanner {

    /** Known chains, matched longest-first so "Giant Eagle" is not also reported as "Giant". */
    private static final List<String> STORE_CATALOG = List.of(
        "Giant Eagle", "Wegmans", "ALDI", "Albertsons", "ShopRite", "Walmart", "Target",
        "Kroger", "Safeway", "Publix", "Whole Foods", "Trader Joe's", "Sprouts", "Food Lion",
        "Meijer", "Hy-Vee", "Stop & Shop", "Giant", "Shoppers", "Harris Teeter"
    ).stream().sorted(Comparator.comparingInt(String::length).reversed()).toList();

    private static final List<String> PRODUCT_KEYWORDS = List.of(
        "oatly", "chobani", "silk", "califia", "planet oat", "almond", "soy", "oat", "milk");

    private static final Pattern SIZE = Pattern.compile(
        "(\\d+(?:\\.\\d+)?\\s*(?:fl oz|oz|ounces?|gallons?|pack|count|ml|l)\\b)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEAL_WORDS = Pattern.compile(
        "\\b(?:discounts?|sale|off|deals?|promotions?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_DECORATION = Pattern.compile("^(?:\\d+[.)]\\s*|[-*•#]+\\s*)+");
    private static final Set<String> OUT_OF_STOCK_WORDS = Set.of("out of stock", "unavailable");

    List<ParsedRecord> scan(String text, RecordKind kind) {
        return kind == RecordKind.STORE ? scanStores(text) : scanProducts(text);
    }

    private List<ParsedRecord> scanStores(String text) {
        // Matched spans are blanked so shorter names inside longer ones are not counted twice.
        char[] remaining = text.toLowerCase(Locale.ROOT).toCharArray();
        List<int[]> hits = new ArrayList<>();
        for (int i = 0; i < STORE_CATALOG.size(); i++) {
            String needle = STORE_CATALOG.get(i).toLowerCase(Locale.ROOT);
            int index = new String(remaining).indexOf(needle);
            if (index < 0) {
                continue;
            }
            hits.add(new int[] {index, i});
            int from = index;
            while (from >= 0) {
                for (int c = from; c < from + needle.length(); c++) {
                    remaining[c] = ' ';
                }
                from = new String(remaining).indexOf(needle, from + needle.length());
            }
        }
        hits.sort(Comparator.comparingInt(hit -> hit[0]));

        List<ParsedRecord> stores = new ArrayList<>();
        for (int[] hit : hits) {
            String name = STORE_CATALOG.get(hit[1]);
            stores.add(new StoreRecord(SlugGenerator.storeId(name), name, null, Set.of(), null, null));
        }
        return stores;
    }

    private List<ParsedRecord> scanProducts(String text) {
        List<ParsedRecord> products = new ArrayList<>();
        LooseProduct current = new LooseProduct();
        for (String rawLine : text.split("\n", -1)) {
            String line = rawLine.replace("**", "").trim();
            if (line.isEmpty()) {
                current.emitInto(products);
                current = new LooseProduct();
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);

            if (current.name == null && PRODUCT_KEYWORDS.stream().anyMatch(lower::contains)) {
                current.name = LIST_DECORATION.matcher(line).replaceFirst("").trim();
            }
            if (line.contains("$")) {
                PriceValue price = PriceValue.parse(line);
                if (price != null && price.isNumeric()) {
                    current.price = price;
                }
            }
            String availability = availabilityOf(lower);
            if (availability != null) {
                current.availability = availability;
            }
            if (DEAL_WORDS.matcher(line).find()) {
                current.deals = line;
            }
            Matcher size = SIZE.matcher(line);
            if (size.find()) {
                current.size = size.group(1);
            }
            Matcher image = TextRecordParser.IMAGE_URL.matcher(line);
            if (image.find()) {
                current.imageUrl = image.group();
            }
        }
        current.emitInto(products);
        return products;
    }

    private static String availabilityOf(String lower) {
        if (OUT_OF_STOCK_WORDS.stream().anyMatch(lower::contains)) {
            return "out of stock";
        }
        if (lower.contains("limited")) {
            return "limited";
        }
        if (lower.contains("in stock") || lower.contains("available")) {
            return "in stock";
        }
        return null;
    }

    private static final class LooseProduct {
        private String name;
        private PriceValue price;
        private String size;
        private String availability;
        private String imageUrl;
        private String deals;

        void emitInto(List<ParsedRecord> out) {
            if (name == null || name.isBlank()) {
                return;
            }
            out.add(new ProductRecord(name, null, price, size, null, availability, null, imageUrl, null, deals));
        }
    }
}
