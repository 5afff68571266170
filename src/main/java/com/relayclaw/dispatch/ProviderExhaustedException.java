package com.relayclaw.dispatch;

import com.relayclaw.shared.model.AppFamily;
import com.relayclaw.shared.model.RelayException;

import java.util.List;

/**
 * No eligible candidate is left for the request.
 */
public class ProviderExhaustedException extends RelayException {

    private final AppFamily family;
    private final List<String> failures;

    public ProviderExhaustedException(AppFamily family, List<String> failures) {
        super(failures.isEmpty()
                ? "No available provider for " + family.id()
                : "All providers failed for " + family.id() + ":\n" + String.join("\n", failures));
        this.family = family;
        this.failures = List.copyOf(failures);
    }

    public AppFamily family() {
        return family;
    }

    public List<String> failures() {
        return failures;
    }
}
