package com.kuruswap.api.validation;

import com.kuruswap.common.InputValidator;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Jakarta Bean Validation adapter over {@link InputValidator#isValidAddress(String)}.
 */
@Component
public class WalletAddressValidator implements ConstraintValidator<WalletAddress, String> {

    private final InputValidator inputValidator;

    public WalletAddressValidator(InputValidator inputValidator) {
        this.inputValidator = inputValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && inputValidator.isValidAddress(value);
    }
}
