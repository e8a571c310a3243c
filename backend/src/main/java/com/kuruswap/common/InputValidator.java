package com.kuruswap.common;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Validates untrusted user input (addresses, amounts, wallet names, private keys) before it reaches
 * the ledger or the swap engine. Native amounts carry 18 decimals.
 */
@Component
public class InputValidator {

    public static final String NATIVE_ASSET = "0x0000000000000000000000000000000000000000";
    public static final int NATIVE_DECIMALS = 18;
    public static final int MAX_WALLET_NAME_LENGTH = 50;
    // uint256 has 78 decimal digits; 18 of them are the native fraction
    public static final int MAX_AMOUNT_INTEGER_DIGITS = 78 - NATIVE_DECIMALS;

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern PRIVATE_KEY = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }

    /**
     * @return trimmed address
     * @throws ValidationException if the address is not 0x + 40 hex
     */
    public String requireAddress(String address) {
        if (!isValidAddress(address)) {
            throw new ValidationException("Address must be 0x followed by 40 hex characters");
        }
        return address.trim();
    }

    /**
     * Token to swap into: a valid address other than the native sentinel.
     */
    public String requireTokenAddress(String address) {
        String trimmed = requireAddress(address);
        if (NATIVE_ASSET.equalsIgnoreCase(trimmed)) {
            throw new ValidationException("Token address must not be the native asset");
        }
        return trimmed;
    }

    /**
     * Parses a user-entered native amount. Must be positive with at most 18 fractional digits.
     * The message never echoes the input.
     */
    public BigDecimal parseAmount(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Amount is required");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Amount is not a number");
        }
        requirePositiveAmount(amount);
        return amount;
    }

    public BigDecimal requirePositiveAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        if (amount.precision() - amount.scale() > MAX_AMOUNT_INTEGER_DIGITS) {
            throw new ValidationException("Amount is too large");
        }
        if (amount.stripTrailingZeros().scale() > NATIVE_DECIMALS) {
            throw new ValidationException("Amount has more than " + NATIVE_DECIMALS + " decimal places");
        }
        return amount;
    }

    /**
     * Native amount in the smallest unit (wei). Exact: no rounding.
     */
    public BigInteger toSmallestUnit(BigDecimal amount) {
        requirePositiveAmount(amount);
        return amount.movePointRight(NATIVE_DECIMALS).toBigIntegerExact();
    }

    public String requireWalletName(String name) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty() || trimmed.length() > MAX_WALLET_NAME_LENGTH) {
            throw new ValidationException("Wallet name must be between 1 and " + MAX_WALLET_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    /**
     * Format check only (0x + 64 hex). The message never echoes the key.
     */
    public String requirePrivateKeyFormat(String privateKey) {
        String trimmed = privateKey == null ? "" : privateKey.strip();
        if (!PRIVATE_KEY.matcher(trimmed).matches()) {
            throw new ValidationException("Private key must be 0x followed by 64 hex characters");
        }
        return trimmed;
    }
}
