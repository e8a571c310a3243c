package com.kuruswap.api.dto;

import com.kuruswap.wallet.ProvisionedWallet;

/**
 * Response of wallet creation. The only response that ever carries a private key.
 */
public record CreatedWalletResponse(String walletId, String name, String address, boolean active, String privateKey) {

    public static CreatedWalletResponse from(ProvisionedWallet wallet) {
        return new CreatedWalletResponse(wallet.walletId(), wallet.name(), wallet.address(), wallet.active(), wallet.privateKey());
    }

    @Override
    public String toString() {
        return "CreatedWalletResponse[walletId=" + walletId + ", address=" + address + "]";
    }
}
