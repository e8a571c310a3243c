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
 * Append-only history entry for a submitted transaction.
 * {@code amount} is the native amount as entered (decimal string, not wei).
 */
@Document(collection = "transactions")
@CompoundIndex(name = "user_created", def = "{'userId': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String walletId;
    private Long userId;
    private String txHash;
    private TransactionType type;
    private String amount;
    private String tokenAddress;
    private TransactionStatus status;
    private Instant createdAt;
}
