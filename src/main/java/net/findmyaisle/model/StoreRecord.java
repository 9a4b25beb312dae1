package net.findmyaisle.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * A store recovered from a store-discovery answer.
 *
 * @param storeId slug of the store name
 * @param storeName display name as reported by the source
 * @param address street address, may be null
 * @param services fulfilment options (delivery, pickup, curbside, in-store, online)
 * @param website store site, may be null
 * @param status open/closed status text, {@code "active"} when unreported
 */
public record StoreRecord(String storeId,
                          String storeName,
                          String address,
                          Set<String> services,
                          String website,
                          String status) implements ParsedRecord {

    public static final String DEFAULT_STATUS = "active";

    public StoreRecord {
        services = services == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(services));
        status = status == null || status.isBlank() ? DEFAULT_STATUS : status;
    }

    @Override
    public String dedupeKey() {
        return storeId.toLowerCase(Locale.ROOT);
    }

    public StoreRef toRef() {
        return new StoreRef(storeId, storeName);
    }
}
