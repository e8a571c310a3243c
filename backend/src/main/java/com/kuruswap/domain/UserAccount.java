package com.kuruswap.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Chat user, keyed by the messaging platform's numeric id. Created on first interaction, never deleted.
 * {@code activeWalletId} always names the single wallet in {@link CustodyWallet} flagged active.
 */
@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserAccount {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String displayName;
    private String activeWalletId;
    private Instant createdAt;
    @Version
    private Long version;
}
