package com.kuruswap.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MongoDB configuration: multi-document transactions for ledger writes (active-wallet switch touches
 * users and wallets). Transactions need a replica set; set kuruswap.ledger.transactions-enabled=false
 * only against a standalone server in development.
 */
@Configuration
@Slf4j
public class MongoConfig {

    public static final String LEDGER_TRANSACTIONS = "ledgerTransactions";

    @Bean
    public MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean(name = LEDGER_TRANSACTIONS)
    public TransactionOperations ledgerTransactions(
            MongoTransactionManager transactionManager,
            @Value("${kuruswap.ledger.transactions-enabled:true}") boolean transactionsEnabled) {
        if (!transactionsEnabled) {
            log.warn("Ledger multi-document transactions are disabled; active-wallet switches are not atomic to readers");
            return TransactionOperations.withoutTransaction();
        }
        return new TransactionTemplate(transactionManager);
    }
}
