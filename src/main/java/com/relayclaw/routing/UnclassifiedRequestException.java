package com.relayclaw.routing;

import com.relayclaw.shared.model.RelayException;

/**
 * The request matches no application family by path or shape.
 */
public class UnclassifiedRequestException extends RelayException {

    public UnclassifiedRequestException(String message) {
        super(message);
    }
}
