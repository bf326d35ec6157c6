package io.macroexpand.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The fragments one request produced, in the order the macro returned them.
 *
 * @param request   the request that produced the fragments
 * @param fragments produced fragments
 */
public record ExpansionResult(ExpansionRequest request, List<Fragment> fragments) {

    public ExpansionResult {
        Objects.requireNonNull(request, "request must not be null");
        fragments = fragments != null ? List.copyOf(fragments) : List.of();
    }

    public static ExpansionResult empty(ExpansionRequest request) {
        return new ExpansionResult(request, List.of());
    }

    public ExpansionResult withFragments(List<Fragment> kept) {
        return new ExpansionResult(request, kept);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }
}
