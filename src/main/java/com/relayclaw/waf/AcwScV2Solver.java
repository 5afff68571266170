package com.relayclaw.waf;

import com.relayclaw.shared.model.UpstreamResponse;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Alibaba Cloud WAF {@code acw_sc__v2} challenge. The challenge page carries
 * {@code var arg1='<40 hex>'}; the answer is arg1 unshuffled by a fixed permutation and
 * XOR-ed byte-wise with a fixed mask, sent back as the {@code acw_sc__v2} cookie.
 */
public class AcwScV2Solver implements WafChallengeSolver {

    static final String COOKIE = "acw_sc__v2";
    private static final Pattern ARG1 = Pattern.compile("var\\s+arg1\\s*=\\s*['\"]([0-9A-Fa-f]{40})['\"]");
    private static final int[] POS_LIST = {
        0xf, 0x23, 0x1d, 0x18, 0x21, 0x10, 0x1, 0x26, 0xa, 0x9,
        0x13, 0x1f, 0x28, 0x1b, 0x16, 0x17, 0x19, 0xd, 0x6, 0xb,
        0x27, 0x12, 0x14, 0x8, 0xe, 0x15, 0x20, 0x1a, 0x2, 0x1e,
        0x7, 0x4, 0x11, 0x5, 0x3, 0x1c, 0x22, 0x25, 0xc, 0x24
    };
    private static final String MASK = "3000176000856006061501533003690027800375";

    @Override
    public String vendor() {
        return "aliyun-acw";
    }

    @Override
    public boolean canSolve(UpstreamResponse response) {
        if (response.body().length == 0) return false;
        var text = response.bodyText();
        if (!isHtmlPage(response.header("Content-Type"), text)) return false;
        return ARG1.matcher(text).find();
    }

    /**
     * The challenge is always an HTML page. Model answers (JSON or an SSE stream) may quote
     * the same script text and must never be taken for a challenge.
     */
    static boolean isHtmlPage(String contentType, String body) {
        var head = body.stripLeading();
        if (head.startsWith("{") || head.startsWith("[") || head.startsWith("data:") || head.startsWith("event:")) {
            return false;
        }
        if (contentType == null) return head.startsWith("<");
        var ct = contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("json") || ct.contains("event-stream")) return false;
        return ct.contains("html") || head.startsWith("<");
    }

    @Override
    public WafSolution solve(UpstreamResponse response) {
        var m = ARG1.matcher(response.bodyText());
        if (!m.find()) throw new WafChallengeException("acw_sc__v2 challenge without arg1");
        return new WafSolution(vendor(), Map.of(COOKIE, token(m.group(1))));
    }

    static String token(String arg1) {
        if (arg1.length() != POS_LIST.length) {
            throw new WafChallengeException("arg1 must be " + POS_LIST.length + " hex chars");
        }
        var unshuffled = new char[POS_LIST.length];
        for (int i = 0; i < arg1.length(); i++) {
            for (int j = 0; j < POS_LIST.length; j++) {
                if (POS_LIST[j] == i + 1) unshuffled[j] = arg1.charAt(i);
            }
        }
        var sb = new StringBuilder(MASK.length());
        for (int i = 0; i + 1 < unshuffled.length && i + 1 < MASK.length(); i += 2) {
            int a = Integer.parseInt(new String(unshuffled, i, 2), 16);
            int b = Integer.parseInt(MASK.substring(i, i + 2), 16);
            var x = Integer.toHexString(a ^ b);
            if (x.length() == 1) sb.append('0');
            sb.append(x);
        }
        return sb.toString();
    }
}
