package io.github.shangor.landrop.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registered handlers of one kind. A handler that throws is logged and does not stop delivery to
 * the others.
 */
public final class ListenerList<L> {
    private static final Logger log = LoggerFactory.getLogger(ListenerList.class);

    private final List<L> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return handle that removes the listener again
     */
    public AutoCloseable subscribe(L listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    public void fire(Consumer<? super L> event) {
        for (L listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
