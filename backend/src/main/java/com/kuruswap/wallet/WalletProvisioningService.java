package com.kuruswap.wallet;

import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.common.InputValidator;
import com.kuruswap.common.ValidationException;
import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates and imports custodial wallets. All input is validated before the ledger is touched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalletProvisioningService {

    private final LedgerStore ledgerStore;
    private final WalletKeyFactory keyFactory;
    private final EvmChainClient chainClient;
    private final InputValidator inputValidator;

    public ProvisionedWallet createWallet(long userId, String displayName, String name) {
        String walletName = inputValidator.requireWalletName(name);
        WalletKeyFactory.KeyMaterial key = keyFactory.generate();
        ledgerStore.createUser(userId, displayName);
        CustodyWallet wallet = ledgerStore.createWallet(userId, walletName, key.address(), key.privateKey());
        log.info("Created wallet {} for user {}", wallet.getId(), userId);
        return new ProvisionedWallet(wallet.getId(), wallet.getName(), wallet.getAddress(), wallet.isActive(), key.privateKey());
    }

    /**
     * @throws ValidationException if the name or key is invalid; nothing is stored in that case
     */
    public CustodyWallet importWallet(long userId, String displayName, String name, String privateKey) {
        String walletName = inputValidator.requireWalletName(name);
        String key = inputValidator.requirePrivateKeyFormat(privateKey);
        String address = keyFactory.deriveAddress(key);
        ledgerStore.createUser(userId, displayName);
        CustodyWallet wallet = ledgerStore.createWallet(userId, walletName, address, key);
        log.info("Imported wallet {} ({}) for user {}", wallet.getId(), address, userId);
        return wallet;
    }

    public WalletBalance getActiveWalletBalance(long userId) {
        CustodyWallet wallet = ledgerStore.getActiveWallet(userId);
        return new WalletBalance(wallet.getId(), wallet.getName(), wallet.getAddress(),
                chainClient.getNativeBalance(wallet.getAddress()));
    }
}
