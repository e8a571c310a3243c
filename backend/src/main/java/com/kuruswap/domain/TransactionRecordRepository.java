package com.kuruswap.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TransactionRecordRepository extends MongoRepository<TransactionRecord, String> {

    List<TransactionRecord> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);
}
