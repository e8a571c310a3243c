package com.kuruswap.api.controller;

import com.kuruswap.domain.TransactionRecord;
import com.kuruswap.domain.TransactionStatus;
import com.kuruswap.domain.TransactionType;
import com.kuruswap.domain.UserAccount;
import com.kuruswap.ledger.LedgerStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = UserController.class)
class UserControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    LedgerStore ledgerStore;

    @Test
    void createUser() {
        UserAccount user = new UserAccount();
        user.setId(7L);
        user.setDisplayName("alice");
        user.setCreatedAt(Instant.parse("2025-01-02T10:00:00Z"));
        when(ledgerStore.createUser(7L, "alice")).thenReturn(user);

        webTestClient.post()
                .uri("/api/v1/users")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":7,\"displayName\":\"alice\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.userId").isEqualTo(7)
                .jsonPath("$.activeWalletId").isEmpty();
    }

    @Test
    void createUser_missingId_400() {
        webTestClient.post()
                .uri("/api/v1/users")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"displayName\":\"alice\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_USER_ID");
        verifyNoInteractions(ledgerStore);
    }

    @Test
    @DisplayName("history is returned newest first as stored, with the requested limit passed through")
    void transactions() {
        TransactionRecord tx = new TransactionRecord();
        tx.setId("t1");
        tx.setWalletId("w00001");
        tx.setUserId(7L);
        tx.setTxHash("0xabc");
        tx.setType(TransactionType.SWAP);
        tx.setAmount("0.1");
        tx.setTokenAddress("0xe0590015a873bf326bd645c3e1266d4db41c4e6b");
        tx.setStatus(TransactionStatus.PENDING);
        tx.setCreatedAt(Instant.parse("2025-01-02T10:00:00Z"));
        when(ledgerStore.listTransactions(7L, 5)).thenReturn(List.of(tx));

        webTestClient.get()
                .uri("/api/v1/users/7/transactions?limit=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].txHash").isEqualTo("0xabc")
                .jsonPath("$[0].type").isEqualTo("SWAP")
                .jsonPath("$[0].status").isEqualTo("PENDING")
                .jsonPath("$[0].amount").isEqualTo("0.1");
        verify(ledgerStore).listTransactions(7L, 5);
    }
}
