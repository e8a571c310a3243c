package com.kuruswap.swap;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SwapProperties.class)
public class SwapConfig {
}
