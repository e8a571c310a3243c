package com.kuruswap.ledger;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CustodyProperties.class)
public class LedgerConfig {

    @Bean
    public SecretCipher secretCipher(CustodyProperties custodyProperties) {
        return SecretCipher.fromBase64Key(custodyProperties.getEncryptionKey());
    }
}
