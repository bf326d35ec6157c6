package io.macroexpand.core.engine;

import io.macroexpand.core.spi.ExpansionListener;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers events to an optional {@link ExpansionListener}. Listener exceptions are caught and
 * logged; they never affect expansion.
 */
final class ListenerNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(ListenerNotifier.class);

    static final ListenerNotifier NONE = new ListenerNotifier(null);

    private final ExpansionListener listener;

    ListenerNotifier(ExpansionListener listener) {
        this.listener = listener; // nullable
    }

    void notify(String callback, Consumer<ExpansionListener> call) {
        if (listener == null) return;
        try {
            call.accept(listener);
        } catch (Exception e) {
            LOG.warn("ExpansionListener.{} failed", callback, e);
        }
    }
}
