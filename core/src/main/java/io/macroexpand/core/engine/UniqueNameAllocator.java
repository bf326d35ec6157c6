package io.macroexpand.core.engine;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues names that cannot collide with user-written names or with each other within one
 * compilation run.
 *
 * <p>
 * The allocator hands out numbered slots, one per expansion request, in scheduling order. A
 * request's context then derives names from its slot and a local counter, so the names a macro
 * receives depend only on scheduling order and not on which worker thread runs it.
 *
 * <p>
 * Thread-safe.
 */
public final class UniqueNameAllocator {

    static final String PREFIX = "__macro_";

    private final AtomicLong slots = new AtomicLong();
    private final Set<String> issued = ConcurrentHashMap.newKeySet();

    /** Reserves the next slot. */
    public long reserveSlot() {
        return slots.incrementAndGet();
    }

    /**
     * Issues the {@code index}-th name of {@code slot}.
     *
     * @param base readable stem; non-identifier characters are replaced with {@code _}
     */
    public String issue(long slot, int index, String base) {
        String name = PREFIX + slot + "_" + index + "_" + sanitize(base);
        issued.add(name);
        return name;
    }

    /** Whether {@code name} was issued by this allocator. */
    public boolean isGenerated(String name) {
        return issued.contains(name);
    }

    public int issuedCount() {
        return issued.size();
    }

    private static String sanitize(String base) {
        if (base == null || base.isEmpty()) {
            return "tmp";
        }
        StringBuilder sb = new StringBuilder(base.length());
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
