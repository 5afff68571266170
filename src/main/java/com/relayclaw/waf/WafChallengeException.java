package com.relayclaw.waf;

import com.relayclaw.shared.model.RelayException;

public class WafChallengeException extends RelayException {

    public WafChallengeException(String message) {
        super(message);
    }
}
