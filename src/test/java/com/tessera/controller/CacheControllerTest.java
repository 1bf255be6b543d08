package com.tessera.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.service.cache.CacheLayer;
import com.tessera.service.cache.MultiLayerCacheManager;
import com.tessera.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheController.
 */
class CacheControllerTest {

    private MultiLayerCacheManager cacheManager;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        cacheManager = new MultiLayerCacheManager(Map.of(), new ObjectMapper(), new MutableClock(),
                Duration.ofMinutes(1));
        client = WebTestClient.bindToController(new CacheController(cacheManager)).build();
    }

    @Test
    void testStatsListAggregateAndLayers() {
        cacheManager.set(CacheLayer.COVERAGE, "k", "v");
        cacheManager.get(CacheLayer.COVERAGE, "k");

        client.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.aggregate.hits").isEqualTo(1)
                .jsonPath("$.layers.coverage.entryCount").isEqualTo(1)
                .jsonPath("$.layers.project_analysis.entryCount").isEqualTo(0);
    }

    @Test
    void testLayerStatsAcceptsEnumName() {
        cacheManager.set(CacheLayer.PROJECT_ANALYSIS, "k", "v");

        client.get().uri("/v1/cache/stats/PROJECT_ANALYSIS")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.entryCount").isEqualTo(1);
    }

    @Test
    void testWarmupPopulatesLayer() {
        client.post().uri("/v1/cache/template-compilation/warmup?batchSize=2")
                .bodyValue(Map.of("javascript-unit", "compiled", "react-component", Map.of("template", "compiled")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.layer").isEqualTo("template_compilation")
                .jsonPath("$.warmedKeys").isEqualTo(2)
                .jsonPath("$.errors").isEmpty()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.durationMs").exists();

        assertEquals(2, cacheManager.getMetrics(CacheLayer.TEMPLATE_COMPILATION).getEntryCount());
        assertTrue(cacheManager.peek(CacheLayer.TEMPLATE_COMPILATION, "javascript-unit").isPresent());
    }

    @Test
    void testWarmupOfUnknownLayerIsBadRequest() {
        client.post().uri("/v1/cache/nope/warmup")
                .bodyValue(Map.of("k", "v"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void testUnknownLayerIsBadRequest() {
        client.post().uri("/v1/cache/nope/clear")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error")
                .jsonPath("$.message").isEqualTo("Unknown cache layer: nope");
    }

    @Test
    void testClearLayer() {
        cacheManager.set(CacheLayer.COVERAGE, "k", "v");

        client.post().uri("/v1/cache/coverage/clear")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("success");

        assertEquals(0, cacheManager.getMetrics(CacheLayer.COVERAGE).getEntryCount());
    }

    @Test
    void testRemoveEntry() {
        cacheManager.set(CacheLayer.COVERAGE, "k", "v");

        client.delete().uri("/v1/cache/coverage/k")
                .exchange()
                .expectStatus().isNoContent();

        assertTrue(cacheManager.get(CacheLayer.COVERAGE, "k").isEmpty());
    }

    @Test
    void testHealth() {
        client.get().uri("/v1/cache/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("HEALTHY");
    }
}
