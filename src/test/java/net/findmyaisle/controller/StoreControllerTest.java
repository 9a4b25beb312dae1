package net.findmyaisle.controller;

import net.findmyaisle.dto.CacheStatus;
import net.findmyaisle.dto.StoreDiscoveryResponse;
import net.findmyaisle.exception.InvalidAggregationRequestException;
import net.findmyaisle.model.StoreRecord;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StoreControllerTest extends AbstractApiControllerMvcTest {

    private StoreDiscoveryResponse pittsburghStores() {
        return new StoreDiscoveryResponse("15213", List.of(
            new StoreRecord("giant_eagle", "Giant Eagle", "4250 Murray Ave", Set.of("pickup"), null, null),
            new StoreRecord("trader_joe_s", "Trader Joe's", null, Set.of(), null, "open"),
            new StoreRecord("aldi", "ALDI", null, Set.of(), null, null)),
            "perplexity_sonar", new CacheStatus(true, false));
    }

    @Test
    void nearbyStores_returnsDiscoveredStores() throws Exception {
        when(storeDiscoveryService.getNearbyStores("15213")).thenReturn(Mono.just(pittsburghStores()));

        performAsync(get("/api/stores/15213"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stores", hasSize(3)))
            .andExpect(jsonPath("$.stores[0].status").value("active"))
            .andExpect(jsonPath("$.cache.hit").value(true));
    }

    @Test
    void nearbyStores_filtersByChainName() throws Exception {
        when(storeDiscoveryService.getNearbyStores("15213")).thenReturn(Mono.just(pittsburghStores()));

        performAsync(get("/api/stores/15213").param("chains", "Giant,aldi"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stores", hasSize(2)))
            .andExpect(jsonPath("$.stores[0].storeId").value("giant_eagle"))
            .andExpect(jsonPath("$.stores[1].storeId").value("aldi"));
    }

    @Test
    void nearbyStores_rejectsMalformedPostalCode() throws Exception {
        when(storeDiscoveryService.getNearbyStores("abcde"))
            .thenThrow(new InvalidAggregationRequestException("Invalid postal code: abcde"));

        performAsync(get("/api/stores/abcde"))
            .andExpect(status().isBadRequest());
    }
}
