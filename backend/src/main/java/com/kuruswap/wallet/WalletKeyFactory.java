package com.kuruswap.wallet;

import com.kuruswap.common.ValidationException;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.GeneralSecurityException;

/**
 * secp256k1 key generation and address derivation. Exception messages never include key material.
 */
@Component
public class WalletKeyFactory {

    public record KeyMaterial(String address, String privateKey) {

        @Override
        public String toString() {
            return "KeyMaterial[address=" + address + "]";
        }
    }

    public KeyMaterial generate() {
        try {
            ECKeyPair keyPair = Keys.createEcKeyPair();
            return new KeyMaterial(
                    Keys.toChecksumAddress(Keys.getAddress(keyPair)),
                    Numeric.toHexStringWithPrefixZeroPadded(keyPair.getPrivateKey(), 64));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("secp256k1 key generation unavailable", e);
        }
    }

    /**
     * EIP-55 address for a 0x-prefixed 32-byte private key.
     *
     * @throws ValidationException if the key is outside the secp256k1 scalar range
     */
    public String deriveAddress(String privateKeyHex) {
        BigInteger key;
        try {
            key = Numeric.toBigInt(privateKeyHex);
        } catch (RuntimeException e) {
            throw new ValidationException("Private key is not valid hex");
        }
        if (key.signum() <= 0 || key.compareTo(Sign.CURVE_PARAMS.getN()) >= 0) {
            throw new ValidationException("Private key is outside the valid secp256k1 range");
        }
        return Keys.toChecksumAddress(Credentials.create(ECKeyPair.create(key)).getAddress());
    }
}
