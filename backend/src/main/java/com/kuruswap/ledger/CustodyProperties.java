package com.kuruswap.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Encryption-at-rest settings for custody secrets. Documented in application.yml under kuruswap.custody.
 */
@ConfigurationProperties(prefix = "kuruswap.custody")
@NoArgsConstructor
@Getter
@Setter
public class CustodyProperties {

    /**
     * Base64-encoded 256-bit AES key. Required; there is no default.
     */
    private String encryptionKey;

    /** Wallet name given to wallets materialized from the legacy single-wallet layout. */
    private String legacyWalletName = "Main Wallet";
}
