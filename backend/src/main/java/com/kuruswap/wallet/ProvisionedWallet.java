package com.kuruswap.wallet;

/**
 * Newly created wallet. Carries the private key so it can be shown to the owner once; it is never
 * returned again.
 */
public record ProvisionedWallet(String walletId, String name, String address, boolean active, String privateKey) {

    @Override
    public String toString() {
        return "ProvisionedWallet[walletId=" + walletId + ", name=" + name + ", address=" + address + ", active=" + active + "]";
    }
}
