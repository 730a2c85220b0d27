package com.starkiller.core.config;

import com.starkiller.core.content.ContentCatalog;
import com.starkiller.core.content.ContentCatalogLoader;
import com.starkiller.core.encounter.GameRandom;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans built from configuration rather than discovered: the content catalog,
 * the session's random source and a fallback meter registry.
 */
@Configuration
public class StarkillerConfig {

    private static final Logger log = LoggerFactory.getLogger(StarkillerConfig.class);

    @Bean
    public ContentCatalog contentCatalog(ContentCatalogLoader loader, StarkillerProperties properties) {
        return loader.load(properties.getContent().getCatalog());
    }

    @Bean
    public GameRandom gameRandom(StarkillerProperties properties) {
        Long configured = properties.getGeneration().getSeed();
        long seed = configured != null ? configured : System.nanoTime();
        log.info("Random source seeded with {}{}", seed, configured != null ? " (configured)" : "");
        return new GameRandom(seed);
    }

    /**
     * In-memory registry used when no monitoring backend provides one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
