package com.relayclaw.waf;

import java.util.Map;

/**
 * Cookies to attach to the single retry.
 */
public record WafSolution(String vendor, Map<String, String> cookies) {

    public WafSolution {
        cookies = Map.copyOf(cookies);
    }
}
