package com.kuruswap.quote;

import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.chain.rpc.RpcException;
import com.kuruswap.common.QuoteUnavailableException;
import com.kuruswap.market.MarketProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Reads the expected route price from the price-routing contract and derives the minimum acceptable
 * output. Integer arithmetic only; every division truncates.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QuoteEngine {

    /** 15% */
    public static final int SLIPPAGE_TOLERANCE_BPS = 1500;
    static final int BPS_DENOMINATOR = 10_000;
    static final BigInteger RATE_UNIT = BigInteger.TEN.pow(18);

    private final EvmChainClient chainClient;
    private final MarketProperties marketProperties;

    /**
     * Single-hop route price for {@code pool}, scaled by 10^18.
     *
     * @param isBuy false for selling the native asset into the pool
     * @throws QuoteUnavailableException if the view call fails or the rate is not positive
     */
    public BigInteger getExpectedRate(String pool, boolean isBuy) {
        Function function = new Function(
                "calculatePriceOverRoute",
                List.<Type>of(
                        new DynamicArray<>(Address.class, List.of(new Address(pool))),
                        new DynamicArray<>(Bool.class, List.of(new Bool(isBuy)))),
                List.of(new TypeReference<Uint256>() {}));
        BigInteger rate;
        try {
            rate = (BigInteger) chainClient.callView(marketProperties.getPriceRouterAddress(), function).get(0).getValue();
        } catch (RpcException e) {
            throw new QuoteUnavailableException("Price unavailable for pool " + pool, e);
        }
        if (rate == null || rate.signum() <= 0) {
            throw new QuoteUnavailableException("Non-positive rate for pool " + pool);
        }
        return rate;
    }

    public static BigInteger computeMinOutput(BigInteger inputAmount, BigInteger rate, int toleranceBps) {
        if (toleranceBps < 0 || toleranceBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("toleranceBps must be within 0.." + BPS_DENOMINATOR);
        }
        BigInteger expected = expectedOutput(inputAmount, rate);
        return expected.multiply(BigInteger.valueOf(BPS_DENOMINATOR - toleranceBps))
                .divide(BigInteger.valueOf(BPS_DENOMINATOR));
    }

    static BigInteger expectedOutput(BigInteger inputAmount, BigInteger rate) {
        return inputAmount.multiply(rate).divide(RATE_UNIT);
    }

    /**
     * Quote for selling {@code amountWei} of the native asset into {@code pool}.
     */
    public Quote quote(String pool, BigInteger amountWei) {
        BigInteger rate = getExpectedRate(pool, false);
        BigInteger expected = expectedOutput(amountWei, rate);
        BigInteger minOutput = computeMinOutput(amountWei, rate, SLIPPAGE_TOLERANCE_BPS);
        log.debug("Quote pool={} in={} rate={} expected={} minOut={}", pool, amountWei, rate, expected, minOutput);
        return new Quote(pool, rate, amountWei, expected, minOutput);
    }
}
