package com.kuruswap.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Test
    @DisplayName("EVM address must be 0x followed by 40 hex characters")
    void addressFormat() {
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isTrue();
        assertThat(validator.isValidAddress(" 0x742d35cc6634c0532925a3b844bc454e4438f44e ")).isTrue();
        assertThat(validator.isValidAddress("742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44")).isFalse();
        assertThat(validator.isValidAddress("0xZZ2d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress("")).isFalse();
    }

    @Test
    @DisplayName("native sentinel is not a swappable token")
    void tokenAddressRejectsNative() {
        assertThatThrownBy(() -> validator.requireTokenAddress(InputValidator.NATIVE_ASSET))
                .isInstanceOf(ValidationException.class);
        assertThat(validator.requireTokenAddress("0xe0590015a873bf326bd645c3e1266d4db41c4e6b"))
                .isEqualTo("0xe0590015a873bf326bd645c3e1266d4db41c4e6b");
    }

    @Test
    @DisplayName("amount must be positive with at most 18 decimals")
    void amountRules() {
        assertThat(validator.parseAmount(" 1.5 ")).isEqualByComparingTo("1.5");
        assertThatThrownBy(() -> validator.parseAmount("0")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.parseAmount("-1")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.parseAmount("abc")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.parseAmount("")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.parseAmount("0.0000000000000000001")).isInstanceOf(ValidationException.class);
        assertThat(validator.parseAmount("1.500000000000000000000")).isEqualByComparingTo("1.5");
    }

    @Test
    @DisplayName("amount beyond the uint256 range is rejected without expanding it")
    void hugeExponentIsRejectedQuickly() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThatThrownBy(() -> validator.parseAmount("1e300000000"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Amount is too large");
            assertThatThrownBy(() -> validator.toSmallestUnit(new BigDecimal("1e300000000")))
                    .isInstanceOf(ValidationException.class);
        });
        String largest = "9".repeat(InputValidator.MAX_AMOUNT_INTEGER_DIGITS);
        assertThat(validator.parseAmount(largest)).isEqualByComparingTo(largest);
        assertThatThrownBy(() -> validator.parseAmount("1" + "0".repeat(InputValidator.MAX_AMOUNT_INTEGER_DIGITS)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("address and amount errors never echo the pasted text")
    void errorsDoNotEchoInput() {
        String pastedKey = "0x" + "4c0883a6".repeat(8);
        assertThatThrownBy(() -> validator.requireAddress(pastedKey))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining("4c0883a6");
        assertThatThrownBy(() -> validator.requireTokenAddress(pastedKey))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining("4c0883a6");
        assertThatThrownBy(() -> validator.parseAmount(pastedKey))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining("4c0883a6");
    }

    @Test
    @DisplayName("conversion to smallest unit is exact")
    void toSmallestUnit() {
        assertThat(validator.toSmallestUnit(new BigDecimal("1"))).isEqualTo(BigInteger.TEN.pow(18));
        assertThat(validator.toSmallestUnit(new BigDecimal("0.000000000000000001"))).isEqualTo(BigInteger.ONE);
        assertThat(validator.toSmallestUnit(new BigDecimal("0.1"))).isEqualTo(new BigInteger("100000000000000000"));
    }

    @Test
    @DisplayName("wallet name is trimmed and must be 1 to 50 characters")
    void walletName() {
        assertThat(validator.requireWalletName("  Trading  ")).isEqualTo("Trading");
        assertThat(validator.requireWalletName("x".repeat(50))).hasSize(50);
        assertThatThrownBy(() -> validator.requireWalletName("   ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.requireWalletName(null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.requireWalletName("x".repeat(51))).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("private key format error never echoes the key")
    void privateKeyFormat() {
        String almostKey = "0x" + "ab".repeat(31) + "zz";
        assertThatThrownBy(() -> validator.requirePrivateKeyFormat(almostKey))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining("abab");
        assertThatThrownBy(() -> validator.requirePrivateKeyFormat("ab".repeat(33)))
                .isInstanceOf(ValidationException.class);
        String key = "0x" + "1".repeat(64);
        assertThat(validator.requirePrivateKeyFormat(" " + key + " ")).isEqualTo(key);
    }
}
