package com.kuruswap.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Custodial wallet owned by exactly one user. The signing key is stored only in encrypted form
 * ({@code encryptedSecret}); this type must never be serialized to API responses or logs.
 */
@Document(collection = "wallets")
@CompoundIndex(name = "user_created", def = "{'userId': 1, 'createdAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CustodyWallet {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Long userId;
    private String name;
    /** EIP-55 checksummed address. */
    private String address;
    private String encryptedSecret;
    private boolean active;
    private Instant createdAt;
}
