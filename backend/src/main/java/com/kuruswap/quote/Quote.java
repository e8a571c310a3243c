package com.kuruswap.quote;

import java.math.BigInteger;

/**
 * Result of one quote. Valid for a single swap attempt and never persisted.
 *
 * @param pool           market the rate was read from
 * @param rate           output per input unit, scaled by 10^18
 * @param inputAmount    input in smallest units
 * @param expectedOutput floor(inputAmount * rate / 10^18)
 * @param minOutput      expectedOutput less the slippage tolerance, floored
 */
public record Quote(String pool, BigInteger rate, BigInteger inputAmount, BigInteger expectedOutput, BigInteger minOutput) {
}
