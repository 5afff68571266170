package com.relayclaw.waf;

import com.relayclaw.shared.model.UpstreamResponse;

/**
 * One WAF vendor's challenge: recognizes its signature and computes the answer.
 */
public interface WafChallengeSolver {

    String vendor();

    boolean canSolve(UpstreamResponse response);

    /**
     * @throws WafChallengeException if the challenge payload is malformed
     */
    WafSolution solve(UpstreamResponse response);
}
