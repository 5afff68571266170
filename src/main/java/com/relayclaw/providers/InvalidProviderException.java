package com.relayclaw.providers;

import com.relayclaw.shared.model.RelayException;

/**
 * A malformed provider definition. Never fatal: the registry logs it and skips the entry.
 */
public class InvalidProviderException extends RelayException {

    public InvalidProviderException(String message) {
        super(message);
    }
}
