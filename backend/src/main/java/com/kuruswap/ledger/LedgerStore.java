package com.kuruswap.ledger;

import com.kuruswap.common.KeyedLocks;
import com.kuruswap.common.NotFoundException;
import com.kuruswap.config.MongoConfig;
import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.domain.CustodyWalletRepository;
import com.kuruswap.domain.TransactionRecord;
import com.kuruswap.domain.TransactionRecordRepository;
import com.kuruswap.domain.TransactionStatus;
import com.kuruswap.domain.TransactionType;
import com.kuruswap.domain.UserAccount;
import com.kuruswap.domain.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns users, custodial wallets and transaction history.
 * <p>
 * Writes touching one user's active-wallet pointer or flags run under a per-user lock and inside one
 * ledger transaction, so concurrent readers never observe a half-applied switch. Operations on
 * different users share no lock.
 */
@Service
@Slf4j
public class LedgerStore {

    static final int MAX_HISTORY = 100;

    private final UserAccountRepository userAccountRepository;
    private final CustodyWalletRepository custodyWalletRepository;
    private final TransactionRecordRepository transactionRecordRepository;
    private final SecretCipher secretCipher;
    private final TransactionOperations ledgerTransactions;
    private final KeyedLocks<Long> userLocks = new KeyedLocks<>();

    public LedgerStore(
            UserAccountRepository userAccountRepository,
            CustodyWalletRepository custodyWalletRepository,
            TransactionRecordRepository transactionRecordRepository,
            SecretCipher secretCipher,
            @Qualifier(MongoConfig.LEDGER_TRANSACTIONS) TransactionOperations ledgerTransactions
    ) {
        this.userAccountRepository = userAccountRepository;
        this.custodyWalletRepository = custodyWalletRepository;
        this.transactionRecordRepository = transactionRecordRepository;
        this.secretCipher = secretCipher;
        this.ledgerTransactions = ledgerTransactions;
    }

    /**
     * Idempotent upsert. An existing user keeps its wallets; only the display name is refreshed.
     */
    public UserAccount createUser(long userId, String displayName) {
        return userLocks.withLock(userId, () -> {
            UserAccount existing = userAccountRepository.findById(userId).orElse(null);
            if (existing != null) {
                if (displayName != null && !displayName.equals(existing.getDisplayName())) {
                    existing.setDisplayName(displayName);
                    return userAccountRepository.save(existing);
                }
                return existing;
            }
            UserAccount user = new UserAccount();
            user.setId(userId);
            user.setDisplayName(displayName);
            user.setCreatedAt(Instant.now());
            try {
                UserAccount saved = userAccountRepository.save(user);
                log.info("Created user {}", userId);
                return saved;
            } catch (DuplicateKeyException e) {
                // created concurrently by another instance
                return userAccountRepository.findById(userId).orElseThrow(() -> e);
            }
        });
    }

    /**
     * Stores a wallet with its secret encrypted. The user's first wallet becomes active and the
     * user's active-wallet pointer is set; later wallets leave the active wallet unchanged.
     */
    public CustodyWallet createWallet(long userId, String name, String address, String secret) {
        String encryptedSecret = secretCipher.encrypt(secret);
        return userLocks.withLock(userId, () -> ledgerTransactions.execute(status -> {
            UserAccount user = requireUser(userId);
            boolean first = custodyWalletRepository.countByUserId(userId) == 0;

            CustodyWallet wallet = new CustodyWallet();
            wallet.setUserId(userId);
            wallet.setName(name);
            wallet.setAddress(address);
            wallet.setEncryptedSecret(encryptedSecret);
            wallet.setActive(first);
            wallet.setCreatedAt(Instant.now());
            CustodyWallet saved = custodyWalletRepository.save(wallet);

            if (first) {
                user.setActiveWalletId(saved.getId());
                userAccountRepository.save(user);
            }
            log.info("Stored wallet {} ({}) for user {}, active={}", saved.getId(), address, userId, first);
            return saved;
        }));
    }

    public List<CustodyWallet> listWallets(long userId) {
        return custodyWalletRepository.findByUserIdOrderByCreatedAtAsc(userId);
    }

    /**
     * Resolves the wallet named by the user's active-wallet pointer.
     *
     * @throws NotFoundException if the user is unknown or has no active wallet
     */
    public CustodyWallet getActiveWallet(long userId) {
        UserAccount user = requireUser(userId);
        String activeWalletId = user.getActiveWalletId();
        if (activeWalletId == null) {
            throw new NotFoundException("User " + userId + " has no active wallet");
        }
        return custodyWalletRepository.findByIdAndUserId(activeWalletId, userId)
                .orElseThrow(() -> new NotFoundException("Active wallet " + activeWalletId + " not found for user " + userId));
    }

    /**
     * Clears the previous active flag, sets the new one and moves the pointer, all or nothing.
     *
     * @throws NotFoundException if the wallet does not exist or belongs to another user
     */
    public CustodyWallet setActiveWallet(long userId, String walletId) {
        return userLocks.withLock(userId, () -> ledgerTransactions.execute(status -> {
            CustodyWallet target = custodyWalletRepository.findByIdAndUserId(walletId, userId)
                    .orElseThrow(() -> new NotFoundException("Wallet " + walletId + " not found for user " + userId));
            UserAccount user = requireUser(userId);

            List<CustodyWallet> changed = new ArrayList<>();
            for (CustodyWallet wallet : custodyWalletRepository.findByUserIdAndActiveTrue(userId)) {
                if (!Objects.equals(wallet.getId(), target.getId())) {
                    wallet.setActive(false);
                    changed.add(wallet);
                }
            }
            target.setActive(true);
            changed.add(target);
            custodyWalletRepository.saveAll(changed);

            user.setActiveWalletId(target.getId());
            userAccountRepository.save(user);
            log.info("User {} switched active wallet to {}", userId, target.getId());
            return target;
        }));
    }

    public TransactionRecord appendTransaction(CustodyWallet wallet, String txHash, TransactionType type,
                                               String amount, String tokenAddress, TransactionStatus status) {
        TransactionRecord tx = new TransactionRecord();
        tx.setWalletId(wallet.getId());
        tx.setUserId(wallet.getUserId());
        tx.setTxHash(txHash);
        tx.setType(type);
        tx.setAmount(amount);
        tx.setTokenAddress(tokenAddress);
        tx.setStatus(status);
        tx.setCreatedAt(Instant.now());
        return transactionRecordRepository.save(tx);
    }

    /**
     * Newest first, at most {@value #MAX_HISTORY} entries.
     */
    public List<TransactionRecord> listTransactions(long userId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return transactionRecordRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, size));
    }

    /**
     * Decrypted signing key. Callers must keep it out of logs and error messages.
     */
    public String revealSecret(CustodyWallet wallet) {
        return secretCipher.decrypt(wallet.getEncryptedSecret());
    }

    /**
     * Runs a write to the user's wallet set under the same lock and transaction as the other wallet mutations.
     */
    void runInUserTransaction(long userId, Runnable work) {
        userLocks.runWithLock(userId, () -> ledgerTransactions.executeWithoutResult(status -> work.run()));
    }

    private UserAccount requireUser(long userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User " + userId + " not found"));
    }
}
