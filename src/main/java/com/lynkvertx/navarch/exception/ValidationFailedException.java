package com.lynkvertx.navarch.exception;

import com.lynkvertx.navarch.dto.ValidationResultDTO;

/**
 * A vessel or offset table failed the checks run before it is stored.
 * Carries every finding, not only the first.
 */
public class ValidationFailedException extends IllegalArgumentException {

    private final ValidationResultDTO result;

    public ValidationFailedException(String message, ValidationResultDTO result) {
        super(message + ": " + result.getErrors().size() + " error(s)");
        this.result = result;
    }

    public ValidationResultDTO getResult() {
        return result;
    }
}
