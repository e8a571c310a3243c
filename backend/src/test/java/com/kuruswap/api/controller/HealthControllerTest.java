package com.kuruswap.api.controller;

import com.kuruswap.chain.ChainProperties;
import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.common.NetworkException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = HealthController.class)
@Import(ChainProperties.class)
class HealthControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    EvmChainClient chainClient;

    @Test
    void reachable_200() {
        when(chainClient.getChainId()).thenReturn(10143L);

        webTestClient.get()
                .uri("/api/v1/health/chain")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.reachable").isEqualTo(true)
                .jsonPath("$.chainId").isEqualTo(10143)
                .jsonPath("$.configuredChainId").isEqualTo(10143);
    }

    @Test
    void unreachable_503() {
        when(chainClient.getChainId()).thenThrow(new NetworkException("eth_chainId failed: chain RPC unavailable"));

        webTestClient.get()
                .uri("/api/v1/health/chain")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.reachable").isEqualTo(false)
                .jsonPath("$.chainId").isEmpty();
    }
}
