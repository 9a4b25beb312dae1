package net.findmyaisle.controller;

import net.findmyaisle.service.AggregationCache;
import net.findmyaisle.service.source.PrimarySourceClient;
import net.findmyaisle.service.source.SecondarySourceClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reports which upstream sources have credentials and whether the result cache is on.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final PrimarySourceClient primarySource;
    private final SecondarySourceClient secondarySource;
    private final AggregationCache cache;

    public HealthController(PrimarySourceClient primarySource,
                            SecondarySourceClient secondarySource,
                            AggregationCache cache) {
        this.primarySource = primarySource;
        this.secondarySource = secondarySource;
        this.cache = cache;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> sources = new LinkedHashMap<>();
        sources.put(primarySource.name().toLowerCase(Locale.ROOT), primarySource.isConfigured());
        sources.put(secondarySource.name().toLowerCase(Locale.ROOT), secondarySource.isConfigured());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", primarySource.isConfigured() ? "ok" : "degraded");
        body.put("sources", sources);
        body.put("cacheEnabled", cache.isEnabled());
        return ResponseEntity.ok(body);
    }
}
