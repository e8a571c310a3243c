package com.kuruswap.api.dto;

import com.kuruswap.session.SessionInput;
import jakarta.validation.constraints.NotNull;

/**
 * One input to the conversation state machine. {@code text} is required for {@link Type#TEXT} only.
 */
public record ConversationRequest(
        @NotNull(message = "INVALID_INPUT")
        Type type,

        String text,

        String displayName
) {

    public enum Type {
        START_CREATE_WALLET,
        START_IMPORT_WALLET,
        START_SWAP,
        TEXT,
        CONFIRM_SWAP,
        CANCEL
    }

    public SessionInput toSessionInput() {
        return switch (type) {
            case START_CREATE_WALLET -> new SessionInput.StartCreateWallet();
            case START_IMPORT_WALLET -> new SessionInput.StartImportWallet();
            case START_SWAP -> new SessionInput.StartSwap();
            case TEXT -> new SessionInput.TextEntered(text);
            case CONFIRM_SWAP -> new SessionInput.ConfirmSwap();
            case CANCEL -> new SessionInput.Cancel();
        };
    }

    @Override
    public String toString() {
        return "ConversationRequest[type=" + type + ", displayName=" + displayName + "]";
    }
}
