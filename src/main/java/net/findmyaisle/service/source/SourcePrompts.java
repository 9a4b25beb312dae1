package net.findmyaisle.service.source;

import net.findmyaisle.model.RecordKind;
import net.findmyaisle.support.parsing.RecordField;

/**
 * Prompts sent to the primary source. The requested layout is generated from
 * {@link RecordField}, so the parser and the prompt cannot drift apart.
 */
public final class SourcePrompts {

    private SourcePrompts() {
    }

    public static String productPrompt(String query, String storeName, String location) {
        return """
            Find current product information for "%s" at %s in %s.

            IMPORTANT: Include product image URLs when available. Search for actual product images from the store's website or product listings.

            Return results in this EXACT format (one product per section, separated by blank lines):

            %s
            Example format:
            PRODUCT: Oatly Oat Milk Original
            BRAND: Oatly
            PRICE: $4.99
            SIZE: 64 oz
            CATEGORY: Dairy Alternatives
            AVAILABILITY: in stock
            DESCRIPTION: Original oat milk, creamy and delicious
            IMAGE_URL: https://target.scene7.com/is/image/Target/12345678
            DEALS: Buy 2 get 1 free

            CRITICAL: Always include the IMAGE_URL field for each product. If you cannot find a specific image URL, use "N/A" but still include the IMAGE_URL field.

            Focus on current availability, accurate pricing, and finding actual product images from the store's website."""
            .formatted(query, storeName, location, layout(RecordKind.PRODUCT));
    }

    public static String storePrompt(String postalCode) {
        return """
            Find all grocery stores and supermarkets serving zip code %s.

            Return results in this EXACT format (one store per section, separated by blank lines):

            %s
            Example format:
            STORE: Giant Eagle
            ADDRESS: 123 Main Street, Pittsburgh, PA 15213
            SERVICES: delivery, pickup, curbside, in-store
            WEBSITE: https://www.gianteagle.com
            STATUS: open

            Focus on major chains: Walmart, Target, Kroger, Safeway, Publix, Whole Foods, Trader Joe's, ALDI, Wegmans, Giant Eagle, Meijer, Hy-Vee, Food Lion, Stop & Shop, and local grocery stores. Provide accurate addresses and current service availability."""
            .formatted(postalCode, layout(RecordKind.STORE));
    }

    static String layout(RecordKind kind) {
        StringBuilder sb = new StringBuilder();
        for (RecordField field : RecordField.fieldsFor(kind)) {
            sb.append(field.marker()).append(' ').append(field.placeholder()).append('\n');
        }
        return sb.toString();
    }
}
