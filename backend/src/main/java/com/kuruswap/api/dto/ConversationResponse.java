package com.kuruswap.api.dto;

import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.session.ConversationSession;
import com.kuruswap.session.SessionResult;
import com.kuruswap.wallet.ProvisionedWallet;
import com.kuruswap.wallet.WalletBalance;

/**
 * @param payload wallet, balance, token metadata, swap preview, swap receipt or error kind, depending on the event
 */
public record ConversationResponse(String event, String state, boolean rejected, String detail, Object payload) {

    public record SwapPreview(String tokenAddress, String tokenName, String tokenSymbol, String pool, String amount) {
    }

    public static ConversationResponse from(SessionResult result) {
        return new ConversationResponse(
                result.event().name(),
                result.state().name(),
                result.event().isRejection(),
                result.detail(),
                toPayload(result.payload()));
    }

    private static Object toPayload(Object payload) {
        if (payload instanceof CustodyWallet wallet) {
            return WalletResponse.from(wallet);
        }
        if (payload instanceof ProvisionedWallet wallet) {
            return CreatedWalletResponse.from(wallet);
        }
        if (payload instanceof WalletBalance balance) {
            return ActiveWalletResponse.from(balance);
        }
        if (payload instanceof ConversationSession session) {
            return new SwapPreview(
                    session.token().address(),
                    session.token().name(),
                    session.token().symbol(),
                    session.pool(),
                    session.amount().toPlainString());
        }
        return payload;
    }
}
