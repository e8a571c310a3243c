package com.kuruswap.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = CaffeineConfig.class)
class CacheConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Test
    @DisplayName("token metadata cache is created and usable")
    void tokenMetaCacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE).get("key1").get()).isEqualTo("value1");
    }
}
