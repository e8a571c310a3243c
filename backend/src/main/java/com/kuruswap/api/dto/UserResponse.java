package com.kuruswap.api.dto;

import com.kuruswap.domain.UserAccount;

import java.time.Instant;

public record UserResponse(Long userId, String displayName, String activeWalletId, Instant createdAt) {

    public static UserResponse from(UserAccount user) {
        return new UserResponse(user.getId(), user.getDisplayName(), user.getActiveWalletId(), user.getCreatedAt());
    }
}
