package com.kuruswap.ledger;

import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.domain.CustodyWalletRepository;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Converts the legacy single-wallet layout (wallet address and plaintext key stored on the user
 * document) into the multi-wallet layout: one active wallet per legacy user, pointer set, legacy
 * fields removed. Any other active wallet of that user is deactivated. Safe to run on every startup.
 */
@Component
@Order(0)
@Slf4j
public class LegacyWalletMigration implements ApplicationRunner {

    static final String USERS_COLLECTION = "users";
    static final String LEGACY_ADDRESS_FIELD = "walletAddress";
    static final String LEGACY_KEY_FIELD = "privateKey";

    private final MongoTemplate mongoTemplate;
    private final CustodyWalletRepository custodyWalletRepository;
    private final SecretCipher secretCipher;
    private final CustodyProperties custodyProperties;
    private final LedgerStore ledgerStore;

    public LegacyWalletMigration(
            MongoTemplate mongoTemplate,
            CustodyWalletRepository custodyWalletRepository,
            SecretCipher secretCipher,
            CustodyProperties custodyProperties,
            LedgerStore ledgerStore
    ) {
        this.mongoTemplate = mongoTemplate;
        this.custodyWalletRepository = custodyWalletRepository;
        this.secretCipher = secretCipher;
        this.custodyProperties = custodyProperties;
        this.ledgerStore = ledgerStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        int migrated = migrate();
        if (migrated > 0) {
            log.info("Migrated {} legacy single-wallet users to the multi-wallet layout", migrated);
        }
    }

    /**
     * @return number of users migrated in this run
     */
    public int migrate() {
        Query legacyUsers = new Query(where(LEGACY_ADDRESS_FIELD).exists(true).ne(null));
        List<Document> documents = mongoTemplate.find(legacyUsers, Document.class, USERS_COLLECTION);
        int migrated = 0;
        for (Document legacy : documents) {
            Object rawId = legacy.get("_id");
            if (!(rawId instanceof Number number)) {
                log.warn("Skipping legacy user with non-numeric id {}", rawId);
                continue;
            }
            long userId = number.longValue();
            String address = legacy.getString(LEGACY_ADDRESS_FIELD);
            String privateKey = legacy.getString(LEGACY_KEY_FIELD);
            if (address == null || address.isBlank() || privateKey == null || privateKey.isBlank()) {
                log.warn("Skipping legacy user {}: incomplete wallet fields", userId);
                continue;
            }
            boolean unversioned = legacy.get("version") == null;
            ledgerStore.runInUserTransaction(userId, () -> migrateUser(rawId, userId, address, privateKey, unversioned));
            migrated++;
        }
        return migrated;
    }

    private void migrateUser(Object rawId, long userId, String address, String privateKey, boolean unversioned) {
        CustodyWallet wallet = custodyWalletRepository.findFirstByUserIdAndAddressIgnoreCase(userId, address)
                .orElseGet(() -> {
                    CustodyWallet created = new CustodyWallet();
                    created.setUserId(userId);
                    created.setName(custodyProperties.getLegacyWalletName());
                    created.setAddress(address);
                    created.setEncryptedSecret(secretCipher.encrypt(privateKey));
                    created.setCreatedAt(Instant.now());
                    return created;
                });
        List<CustodyWallet> othersActive = custodyWalletRepository.findByUserIdAndActiveTrue(userId).stream()
                .filter(other -> !Objects.equals(other.getId(), wallet.getId()))
                .toList();
        if (!othersActive.isEmpty()) {
            othersActive.forEach(other -> other.setActive(false));
            custodyWalletRepository.saveAll(othersActive);
        }
        wallet.setActive(true);
        CustodyWallet saved = custodyWalletRepository.save(wallet);

        Update update = new Update()
                .set("activeWalletId", saved.getId())
                .unset(LEGACY_ADDRESS_FIELD)
                .unset(LEGACY_KEY_FIELD);
        if (unversioned) {
            // UserAccount is optimistically versioned; a null version would be treated as a new document
            update.set("version", 0L);
        }
        mongoTemplate.updateFirst(new Query(where("_id").is(rawId)), update, USERS_COLLECTION);
    }
}
