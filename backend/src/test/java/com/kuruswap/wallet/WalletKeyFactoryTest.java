package com.kuruswap.wallet;

import com.kuruswap.common.ValidationException;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalletKeyFactoryTest {

    private static final String KNOWN_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String KNOWN_ADDRESS = "0x2c7536E3605D9C16a7a3D7b1898e529396a65c23";

    private final WalletKeyFactory factory = new WalletKeyFactory();

    @Test
    void deriveAddress_knownVector() {
        assertThat(factory.deriveAddress(KNOWN_KEY)).isEqualTo(KNOWN_ADDRESS);
    }

    @Test
    void generate_producesMatchingChecksummedPair() {
        WalletKeyFactory.KeyMaterial key = factory.generate();

        assertThat(key.privateKey()).matches("^0x[0-9a-f]{64}$");
        assertThat(key.address()).isEqualTo(Keys.toChecksumAddress(key.address()));
        assertThat(factory.deriveAddress(key.privateKey())).isEqualTo(key.address());
    }

    @Test
    void generate_isRandom() {
        assertThat(factory.generate().privateKey()).isNotEqualTo(factory.generate().privateKey());
    }

    @Test
    void keyMaterial_toStringHidesKey() {
        WalletKeyFactory.KeyMaterial key = factory.generate();
        assertThat(key.toString()).contains(key.address()).doesNotContain(key.privateKey().substring(2));
    }

    @Test
    void deriveAddress_outOfRange_rejected() {
        String zero = "0x" + "0".repeat(64);
        String order = Numeric.toHexStringWithPrefixZeroPadded(Sign.CURVE_PARAMS.getN(), 64);

        assertThatThrownBy(() -> factory.deriveAddress(zero)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> factory.deriveAddress(order))
                .isInstanceOf(ValidationException.class)
                .hasMessageNotContaining(order.substring(2));
    }
}
