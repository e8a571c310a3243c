package com.kuruswap.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for wallets. Writes to the active flag go through LedgerStore only.
 */
public interface CustodyWalletRepository extends MongoRepository<CustodyWallet, String> {

    List<CustodyWallet> findByUserIdOrderByCreatedAtAsc(Long userId);

    Optional<CustodyWallet> findByIdAndUserId(String id, Long userId);

    List<CustodyWallet> findByUserIdAndActiveTrue(Long userId);

    Optional<CustodyWallet> findFirstByUserIdAndAddressIgnoreCase(Long userId, String address);

    long countByUserId(Long userId);
}
