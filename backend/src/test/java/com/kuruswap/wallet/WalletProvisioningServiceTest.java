package com.kuruswap.wallet;

import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.common.InputValidator;
import com.kuruswap.common.NotFoundException;
import com.kuruswap.common.ValidationException;
import com.kuruswap.domain.CustodyWallet;
import com.kuruswap.ledger.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletProvisioningServiceTest {

    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String ADDRESS = "0x2c7536E3605D9C16a7a3D7b1898e529396a65c23";

    @Mock
    LedgerStore ledgerStore;
    @Mock
    EvmChainClient chainClient;

    private WalletProvisioningService service;

    @BeforeEach
    void setUp() {
        service = new WalletProvisioningService(ledgerStore, new WalletKeyFactory(), chainClient, new InputValidator());
    }

    @Test
    @DisplayName("created wallet returns its key once and stores the same key")
    void createWallet() {
        when(ledgerStore.createWallet(eq(7L), eq("main"), anyString(), anyString())).thenAnswer(inv -> {
            CustodyWallet wallet = wallet(inv.getArgument(2));
            wallet.setName(inv.getArgument(1));
            return wallet;
        });

        ProvisionedWallet created = service.createWallet(7L, "alice", "  main ");

        assertThat(created.walletId()).isEqualTo("w00001");
        assertThat(created.name()).isEqualTo("main");
        assertThat(created.active()).isTrue();
        assertThat(new WalletKeyFactory().deriveAddress(created.privateKey())).isEqualTo(created.address());
        assertThat(created.toString()).doesNotContain(created.privateKey().substring(2));
        verify(ledgerStore).createUser(7L, "alice");
        verify(ledgerStore).createWallet(7L, "main", created.address(), created.privateKey());
    }

    @Test
    void createWallet_invalidName_touchesNothing() {
        assertThatThrownBy(() -> service.createWallet(7L, "alice", " ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.createWallet(7L, "alice", "x".repeat(51))).isInstanceOf(ValidationException.class);
        verifyNoInteractions(ledgerStore);
    }

    @Test
    @DisplayName("imported key is stored with its derived checksummed address")
    void importWallet() {
        CustodyWallet stored = wallet(ADDRESS);
        when(ledgerStore.createWallet(7L, "trading", ADDRESS, KEY)).thenReturn(stored);

        CustodyWallet imported = service.importWallet(7L, "alice", "trading", " " + KEY + "\n");

        assertThat(imported).isSameAs(stored);
        verify(ledgerStore).createUser(7L, "alice");
    }

    @Test
    @DisplayName("malformed or out-of-range key fails without storing anything and without echoing the key")
    void importWallet_invalidKey() {
        String shortKey = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f3623";
        String zeroKey = "0x" + "0".repeat(64);

        assertThatThrownBy(() -> service.importWallet(7L, "alice", "trading", shortKey))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining(shortKey.substring(2));
        assertThatThrownBy(() -> service.importWallet(7L, "alice", "trading", zeroKey))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.importWallet(7L, "alice", "", KEY))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(ledgerStore);
    }

    @Test
    void activeWalletBalance() {
        when(ledgerStore.getActiveWallet(7L)).thenReturn(wallet(ADDRESS));
        when(chainClient.getNativeBalance(ADDRESS)).thenReturn(new BigDecimal("1.250000000000000000"));

        WalletBalance balance = service.getActiveWalletBalance(7L);

        assertThat(balance.walletId()).isEqualTo("w00001");
        assertThat(balance.address()).isEqualTo(ADDRESS);
        assertThat(balance.balance()).isEqualByComparingTo("1.25");
    }

    @Test
    void activeWalletBalance_noWallet() {
        when(ledgerStore.getActiveWallet(7L)).thenThrow(new NotFoundException("User 7 has no active wallet"));

        assertThatThrownBy(() -> service.getActiveWalletBalance(7L)).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(chainClient);
    }

    private static CustodyWallet wallet(String address) {
        CustodyWallet wallet = new CustodyWallet();
        wallet.setId("w00001");
        wallet.setUserId(7L);
        wallet.setName("main");
        wallet.setAddress(address);
        wallet.setActive(true);
        return wallet;
    }
}
