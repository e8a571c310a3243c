package com.kuruswap.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kuruswap.chain.rpc.EvmRpcClient;
import com.kuruswap.chain.rpc.RpcEndpointRotator;
import com.kuruswap.chain.rpc.RpcException;
import com.kuruswap.common.InputValidator;
import com.kuruswap.common.NetworkException;
import com.kuruswap.common.SubmissionException;
import com.kuruswap.config.CaffeineConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read and submit operations against the configured EVM chain over JSON-RPC.
 * <p>
 * Every call goes through the local rate limiter and the shared WebClient with a bounded timeout.
 * Calls are not retried: a transport failure moves the rotator to the next endpoint and surfaces as
 * {@link NetworkException}.
 */
@Component
@Slf4j
public class EvmChainClient {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final CacheManager cacheManager;
    private final InputValidator inputValidator;

    public EvmChainClient(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            CacheManager cacheManager,
            InputValidator inputValidator
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.cacheManager = cacheManager;
        this.inputValidator = inputValidator;
    }

    public boolean isReachable() {
        try {
            getChainId();
            return true;
        } catch (NetworkException e) {
            log.debug("Chain not reachable: {}", e.getMessage());
            return false;
        }
    }

    public long getChainId() {
        return quantity(requireResult(call("eth_chainId", List.of()), "eth_chainId"), "eth_chainId").longValueExact();
    }

    public BigInteger getNativeBalanceWei(String address) {
        String checked = inputValidator.requireAddress(address);
        return quantity(requireResult(call("eth_getBalance", List.of(checked, "latest")), "eth_getBalance"), "eth_getBalance");
    }

    /**
     * Native balance in whole units, scale 18.
     */
    public BigDecimal getNativeBalance(String address) {
        return new BigDecimal(getNativeBalanceWei(address), InputValidator.NATIVE_DECIMALS);
    }

    public BigInteger getGasPrice() {
        return quantity(requireResult(call("eth_gasPrice", List.of()), "eth_gasPrice"), "eth_gasPrice");
    }

    /**
     * Next nonce including transactions still in the mempool.
     */
    public BigInteger getNonce(String address) {
        String checked = inputValidator.requireAddress(address);
        return quantity(requireResult(call("eth_getTransactionCount", List.of(checked, "pending")), "eth_getTransactionCount"),
                "eth_getTransactionCount");
    }

    /**
     * ERC20 name, symbol and decimals. Cached per address in tokenMetaCache; failures are not cached.
     *
     * @throws InvalidTokenException if the address is malformed or does not answer the ERC20 read interface
     * @throws NetworkException      if the RPC endpoint is unreachable
     */
    public TokenMetadata getTokenMetadata(String tokenAddress) {
        if (!inputValidator.isValidAddress(tokenAddress)) {
            throw new InvalidTokenException("Token address must be 0x followed by 40 hex characters");
        }
        String address = tokenAddress.trim();
        Cache cache = cacheManager.getCache(CaffeineConfig.TOKEN_META_CACHE);
        if (cache == null) {
            return fetchTokenMetadata(address);
        }
        try {
            return cache.get(address.toLowerCase(), () -> fetchTokenMetadata(address));
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * eth_call against {@code contract} at the latest block, decoded with the function's output types.
     *
     * @throws RpcException     if the node returns a JSON-RPC error or the result cannot be decoded
     * @throws NetworkException if the RPC endpoint is unreachable
     */
    public List<Type> callView(String contract, Function function) {
        String data = FunctionEncoder.encode(function);
        JsonNode root = call("eth_call", List.of(Map.of("to", contract, "data", data), "latest"));
        JsonNode error = root.path("error");
        if (!error.isMissingNode()) {
            throw new RpcException(function.getName() + " reverted: " + error.path("message").asText(error.toString()));
        }
        String result = root.path("result").asText("");
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(result, function.getOutputParameters());
        } catch (RuntimeException e) {
            throw new RpcException("Cannot decode " + function.getName() + " result", e);
        }
        if (decoded.size() != function.getOutputParameters().size()) {
            throw new RpcException(function.getName() + " returned no data");
        }
        return decoded;
    }

    /**
     * eth_sendRawTransaction.
     *
     * @return transaction hash
     * @throws SubmissionException if the node rejects the transaction
     * @throws NetworkException    if the RPC endpoint is unreachable
     */
    public String sendSignedTransaction(String signedTransactionHex) {
        JsonNode root = call("eth_sendRawTransaction", List.of(signedTransactionHex));
        JsonNode error = root.path("error");
        if (!error.isMissingNode()) {
            throw new SubmissionException("Transaction rejected: " + error.path("message").asText(error.toString()));
        }
        String txHash = root.path("result").asText(null);
        if (txHash == null || txHash.isBlank()) {
            throw new SubmissionException("Node accepted the transaction but returned no hash");
        }
        return txHash;
    }

    private TokenMetadata fetchTokenMetadata(String address) {
        try {
            String name = (String) callView(address, erc20Read("name", new TypeReference<Utf8String>() {})).get(0).getValue();
            String symbol = (String) callView(address, erc20Read("symbol", new TypeReference<Utf8String>() {})).get(0).getValue();
            BigInteger decimals = (BigInteger) callView(address, erc20Read("decimals", new TypeReference<Uint8>() {})).get(0).getValue();
            TokenMetadata metadata = new TokenMetadata(address, name, symbol, decimals.intValueExact());
            log.debug("Fetched token metadata {} ({}, {} decimals)", address, symbol, metadata.decimals());
            return metadata;
        } catch (RpcException | ArithmeticException e) {
            throw new InvalidTokenException("Address " + address + " is not an ERC20 token", e);
        }
    }

    private static Function erc20Read(String name, TypeReference<?> output) {
        return new Function(name, Collections.emptyList(), List.of(output));
    }

    private JsonNode call(String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new NetworkException("Local RPC limiter timeout before " + method);
        }
        String endpoint = rotator.current();
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block();
        } catch (RpcException e) {
            log.warn("{} failed on {}: {}", method, endpoint, e.getMessage());
            rotator.failover(endpoint);
            throw new NetworkException(method + " failed: chain RPC unavailable", e);
        }
        if (json == null || json.isBlank()) {
            rotator.failover(endpoint);
            throw new NetworkException(method + " returned an empty response");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            rotator.failover(endpoint);
            throw new NetworkException(method + " returned malformed JSON", e);
        }
    }

    private static String requireResult(JsonNode root, String method) {
        JsonNode error = root.path("error");
        if (!error.isMissingNode()) {
            throw new NetworkException(method + " error: " + error.path("message").asText(error.toString()));
        }
        String result = root.path("result").asText(null);
        if (result == null) {
            throw new NetworkException(method + " returned no result");
        }
        return result;
    }

    private static BigInteger quantity(String hex, String method) {
        try {
            return Numeric.decodeQuantity(hex);
        } catch (RuntimeException e) {
            throw new NetworkException(method + " returned a malformed quantity", e);
        }
    }
}
