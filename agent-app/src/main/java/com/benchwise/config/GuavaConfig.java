package com.benchwise.config;

import com.benchwise.domain.document.model.entity.MatterEntity;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Local Guava caches.
 *
 * @author benchwise
 * @since 2026-03-08
 */
@Configuration
public class GuavaConfig {

    /**
     * Matter lookups. Matters rarely change, but entries still expire quickly so edits
     * made elsewhere show up within seconds.
     */
    @Bean(name = "matterCache")
    public Cache<Long, Optional<MatterEntity>> matterCache(
            @Value("${cache.matter.expire-after-write-seconds:30}") long expireAfterWriteSeconds,
            @Value("${cache.matter.maximum-size:1000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(expireAfterWriteSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
