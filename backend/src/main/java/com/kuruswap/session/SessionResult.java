package com.kuruswap.session;

import java.util.Optional;

/**
 * @param event   what happened
 * @param state   conversation state after the input
 * @param detail  human-readable reason for rejections; never contains key material
 * @param payload created wallet, token metadata, balance, swap receipt or error kind, depending on the event
 */
public record SessionResult(SessionEvent event, ConversationState state, String detail, Object payload) {

    static SessionResult of(SessionEvent event, ConversationState state) {
        return new SessionResult(event, state, null, null);
    }

    static SessionResult of(SessionEvent event, ConversationState state, Object payload) {
        return new SessionResult(event, state, null, payload);
    }

    static SessionResult rejected(SessionEvent event, ConversationState state, String detail) {
        return new SessionResult(event, state, detail, null);
    }

    public <T> Optional<T> payload(Class<T> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }
}
