package com.relayclaw.dispatch;

import com.relayclaw.shared.model.RelayException;

/**
 * The caller went away; the dispatch loop stops without trying further candidates.
 */
public class DispatchCancelledException extends RelayException {

    public DispatchCancelledException(String message) {
        super(message);
    }

    public DispatchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
