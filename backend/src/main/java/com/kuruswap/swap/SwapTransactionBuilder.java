package com.kuruswap.swap;

import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.common.InputValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.RawTransaction;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * Builds the unsigned router call that sells the native asset into one pool. Gas price and nonce are
 * read from the chain on every build.
 */
@Component
@RequiredArgsConstructor
public class SwapTransactionBuilder {

    public static final BigInteger GAS_LIMIT = BigInteger.valueOf(250_000);

    private final EvmChainClient chainClient;
    private final SwapProperties swapProperties;

    public RawTransaction build(String fromAddress, String pool, String tokenAddress, BigInteger amountWei, BigInteger minOutput) {
        BigInteger gasPrice = chainClient.getGasPrice();
        BigInteger nonce = chainClient.getNonce(fromAddress);
        return RawTransaction.createTransaction(
                nonce,
                gasPrice,
                GAS_LIMIT,
                swapProperties.getRouterAddress(),
                amountWei,
                encodeSwapCall(pool, tokenAddress, amountWei, minOutput));
    }

    /**
     * anyToAnySwap(address[] markets, bool[] isBuy, bool[] nativeSend, address debit, address credit,
     * uint256 amount, uint256 minOut) with a single market, native asset debited and sent as value.
     */
    static String encodeSwapCall(String pool, String tokenAddress, BigInteger amountWei, BigInteger minOutput) {
        Function function = new Function(
                "anyToAnySwap",
                List.<Type>of(
                        new DynamicArray<>(Address.class, List.of(new Address(pool))),
                        new DynamicArray<>(Bool.class, List.of(new Bool(true))),
                        new DynamicArray<>(Bool.class, List.of(new Bool(true))),
                        new Address(InputValidator.NATIVE_ASSET),
                        new Address(tokenAddress),
                        new Uint256(amountWei),
                        new Uint256(minOutput)),
                Collections.emptyList());
        return FunctionEncoder.encode(function);
    }
}
