package io.macroexpand.core.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * The accessor block of a property or subscript.
 *
 * @param accessors accessors in source order
 */
public record AccessorBlock(List<Accessor> accessors) {

    public AccessorBlock {
        accessors = accessors != null ? List.copyOf(accessors) : List.of();
    }

    public static AccessorBlock of(Accessor... accessors) {
        return new AccessorBlock(List.of(accessors));
    }

    /** Returns {@code true} if the block only holds {@code willSet}/{@code didSet} observers. */
    public boolean isObserversOnly() {
        return accessors.stream().allMatch(accessor -> accessor.kind().isObserver());
    }

    public AccessorBlock append(List<Accessor> more) {
        List<Accessor> combined = new ArrayList<>(accessors);
        combined.addAll(more);
        return new AccessorBlock(combined);
    }
}
