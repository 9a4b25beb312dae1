package net.findmyaisle.config;

import jakarta.annotation.PostConstruct;
import net.findmyaisle.util.SlugGenerator;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strongly typed configuration for multi-store aggregation.
 */
@Component
@ConfigurationProperties(prefix = "aggregation")
public class AggregationProperties {

    public static final List<String> DEFAULT_COVERAGE_SERVICES = List.of("pickup", "delivery");

    /**
     * Upper bound on candidate stores per aggregation call.
     */
    private int maxStores = 10;

    /**
     * Maximum number of in-flight primary source calls per aggregation.
     */
    private int maxConcurrency = 10;

    /**
     * Timeout for each source call made for one store. The secondary fallback gets its own
     * budget, so a store whose primary call times out may take up to twice this long.
     */
    private Duration perStoreTimeout = Duration.ofSeconds(20);

    /**
     * Lifetime of cached aggregation results.
     */
    private Duration productsTtl = Duration.ofHours(4);

    /**
     * Lifetime of cached store-discovery results.
     */
    private Duration storesTtl = Duration.ofHours(24);

    /**
     * Fraction of the full TTL below which a cache hit is reported as near-stale.
     */
    private double nearStaleRatio = 0.2;

    /**
     * Accepted postal code format.
     */
    private String postalCodePattern = "^\\d{5}$";

    /**
     * Display names used in prompts, keyed by store id. Ids without an entry are title-cased.
     */
    private Map<String, String> storeNames = new LinkedHashMap<>();

    /**
     * Shopping domains keyed by store id, used to scope and filter secondary results.
     */
    private Map<String, String> storeDomains = new LinkedHashMap<>();

    /**
     * Static postal coverage ranges ({@code 15000-16999}) keyed by store id, used when
     * discovery through the primary source finds nothing.
     */
    private Map<String, List<String>> coverage = new LinkedHashMap<>();

    /**
     * Fulfilment services reported for static coverage stores, keyed by store id.
     * Stores without an entry get {@link #DEFAULT_COVERAGE_SERVICES}.
     */
    private Map<String, List<String>> coverageServices = new LinkedHashMap<>();

    /**
     * Location passed to the secondary shopping search.
     */
    private String secondaryLocationHint = "United States";

    private Pattern compiledPostalCodePattern;

    @PostConstruct
    void validate() {
        Assert.isTrue(maxStores > 0, "aggregation.max-stores must be positive");
        Assert.isTrue(maxConcurrency > 0, "aggregation.max-concurrency must be positive");
        Assert.isTrue(!perStoreTimeout.isNegative() && !perStoreTimeout.isZero(),
                "aggregation.per-store-timeout must be positive");
        Assert.isTrue(!productsTtl.isNegative(), "aggregation.products-ttl must be non-negative");
        Assert.isTrue(!storesTtl.isNegative(), "aggregation.stores-ttl must be non-negative");
        Assert.isTrue(nearStaleRatio >= 0 && nearStaleRatio <= 1, "aggregation.near-stale-ratio must be within [0, 1]");
        compiledPostalCodePattern = Pattern.compile(postalCodePattern);
    }

    public boolean isValidPostalCode(String postalCode) {
        if (postalCode == null) {
            return false;
        }
        Pattern pattern = compiledPostalCodePattern != null ? compiledPostalCodePattern : Pattern.compile(postalCodePattern);
        return pattern.matcher(postalCode).matches();
    }

    public String displayNameFor(String storeId) {
        String key = storeId == null ? "" : storeId.toLowerCase(Locale.ROOT);
        String configured = storeNames.get(key);
        return configured != null ? configured : SlugGenerator.titleCase(key);
    }

    public List<String> coverageServicesFor(String storeId) {
        List<String> services = coverageServices.get(storeId);
        return services != null ? services : DEFAULT_COVERAGE_SERVICES;
    }

    public Optional<String> domainFor(String storeId) {
        if (storeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storeDomains.get(storeId.toLowerCase(Locale.ROOT)));
    }

    public int getMaxStores() {
        return maxStores;
    }

    public void setMaxStores(int maxStores) {
        this.maxStores = maxStores;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getPerStoreTimeout() {
        return perStoreTimeout;
    }

    public void setPerStoreTimeout(Duration perStoreTimeout) {
        this.perStoreTimeout = perStoreTimeout;
    }

    public Duration getProductsTtl() {
        return productsTtl;
    }

    public void setProductsTtl(Duration productsTtl) {
        this.productsTtl = productsTtl;
    }

    public Duration getStoresTtl() {
        return storesTtl;
    }

    public void setStoresTtl(Duration storesTtl) {
        this.storesTtl = storesTtl;
    }

    public double getNearStaleRatio() {
        return nearStaleRatio;
    }

    public void setNearStaleRatio(double nearStaleRatio) {
        this.nearStaleRatio = nearStaleRatio;
    }

    public String getPostalCodePattern() {
        return postalCodePattern;
    }

    public void setPostalCodePattern(String postalCodePattern) {
        this.postalCodePattern = postalCodePattern;
        this.compiledPostalCodePattern = null;
    }

    public Map<String, String> getStoreNames() {
        return storeNames;
    }

    public void setStoreNames(Map<String, String> storeNames) {
        this.storeNames = storeNames;
    }

    public Map<String, String> getStoreDomains() {
        return storeDomains;
    }

    public void setStoreDomains(Map<String, String> storeDomains) {
        this.storeDomains = storeDomains;
    }

    public String getSecondaryLocationHint() {
        return secondaryLocationHint;
    }

    public void setSecondaryLocationHint(String secondaryLocationHint) {
        this.secondaryLocationHint = secondaryLocationHint;
    }

    public Map<String, List<String>> getCoverage() {
        return coverage;
    }

    public void setCoverage(Map<String, List<String>> coverage) {
        this.coverage = coverage;
    }

    public Map<String, List<String>> getCoverageServices() {
        return coverageServices;
    }

    public void setCoverageServices(Map<String, List<String>> coverageServices) {
        this.coverageServices = coverageServices;
    }
}
