package net.gaiming.config;

import net.gaiming.support.cache.CacheService;
import net.gaiming.support.cache.CaffeineCacheService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public CacheService cacheService(@Value("${gaiming.cache.maximum-size:50000}") long maximumSize) {
        return new CaffeineCacheService(maximumSize);
    }
}
