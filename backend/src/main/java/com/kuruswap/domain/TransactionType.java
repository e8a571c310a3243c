package com.kuruswap.domain;

public enum TransactionType {
    SWAP
}
