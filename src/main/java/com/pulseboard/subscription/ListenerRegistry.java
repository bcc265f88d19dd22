package com.pulseboard.subscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered registry of listeners with explicit handles.
 *
 * <p>Listeners are invoked synchronously, in registration order, on the publishing thread.
 * A listener that throws is logged and skipped; the remaining listeners still receive the
 * event. Listeners registered or removed during a publish take effect from the next publish.
 *
 * @param <E> event type delivered to listeners
 */
public class ListenerRegistry<E> {

    private static final Logger log = LoggerFactory.getLogger(ListenerRegistry.class);

    private final String name;
    private final Map<Long, Consumer<? super E>> listeners = new LinkedHashMap<>();
    private long nextId = 1;

    public ListenerRegistry(String name) {
        this.name = name;
    }

    public synchronized ListenerHandle subscribe(Consumer<? super E> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        long id = nextId++;
        listeners.put(id, listener);
        return new ListenerHandle(name, id);
    }

    /**
     * Removes exactly the listener registered under {@code handle}.
     *
     * @return true if a listener was removed, false for unknown, foreign or already-removed handles
     */
    public synchronized boolean unsubscribe(ListenerHandle handle) {
        if (handle == null || !name.equals(handle.registry())) {
            return false;
        }
        return listeners.remove(handle.id()) != null;
    }

    public void publish(E event) {
        List<Consumer<? super E>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(listeners.values());
        }
        for (Consumer<? super E> listener : snapshot) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener in {} failed, continuing with remaining listeners: {}", name, e.getMessage(), e);
            }
        }
    }

    public synchronized int size() {
        return listeners.size();
    }

    public String getName() {
        return name;
    }
}
