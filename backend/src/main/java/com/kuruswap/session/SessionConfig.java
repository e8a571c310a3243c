package com.kuruswap.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionConfig {

    @Bean
    public Cache<Long, ConversationSession> conversationSessions(SessionProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(properties.getTtlMinutes()))
                .maximumSize(properties.getMaxSessions())
                .build();
    }
}
