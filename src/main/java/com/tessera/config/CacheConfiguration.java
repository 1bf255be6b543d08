package com.tessera.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.service.cache.CacheLayer;
import com.tessera.service.cache.CacheLayerConfig;
import com.tessera.service.cache.MultiLayerCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Multi-layer cache configuration.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final TesseraProperties properties;

    public CacheConfiguration(TesseraProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "stop")
    public MultiLayerCacheManager cacheManager(ObjectMapper objectMapper, Clock clock) {
        MultiLayerCacheManager cacheManager = new MultiLayerCacheManager(layerConfigs(), objectMapper, clock,
                properties.getCache().getCleanupInterval());
        cacheManager.start();
        return cacheManager;
    }

    private Map<CacheLayer, CacheLayerConfig> layerConfigs() {
        Map<CacheLayer, CacheLayerConfig> configs = new EnumMap<>(CacheLayer.class);
        for (CacheLayer layer : CacheLayer.values()) {
            configs.put(layer, layer.defaultConfig());
        }
        properties.getCache().getLayers().forEach((id, overrides) -> {
            CacheLayer layer = CacheLayer.fromId(id);
            configs.put(layer, overrides.applyTo(configs.get(layer)));
            log.info("Cache layer {} configured: {}", layer.getId(), configs.get(layer));
        });
        return configs;
    }
}
