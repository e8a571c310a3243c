package com.kuruswap.market;

import com.kuruswap.common.NetworkException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Component
public class WebClientMarketDiscoveryClient implements MarketDiscoveryClient {

    private final WebClient webClient;
    private final MarketProperties properties;

    public WebClientMarketDiscoveryClient(WebClient.Builder webClientBuilder, MarketProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public Mono<String> filterMarkets(MarketFilterRequest request) {
        return webClient.post()
                .uri(properties.getDiscoveryUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .onErrorMap(TimeoutException.class,
                        e -> new NetworkException("Market discovery timed out after " + properties.getTimeoutMs() + " ms", e))
                .onErrorMap(WebClientResponseException.class,
                        e -> new NetworkException("Market discovery returned HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(e -> !(e instanceof NetworkException),
                        e -> new NetworkException("Market discovery unreachable", e));
    }
}
