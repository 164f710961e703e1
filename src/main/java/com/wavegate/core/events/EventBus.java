package com.wavegate.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Routes scheduler and gate events to the observers of a session.
 * <p>
 * Observers register either for one session (SSE streams, WebSocket connections) or for every
 * session (metrics, tests). Publishing runs on the caller's thread, so one session's events
 * reach an observer in the order the scheduler emitted them. An observer that throws is logged
 * and skipped.
 * <p>
 * Registration and removal for a session key are applied inside the map's per-key
 * {@code compute} calls, so an observer that reconnects while its old connection is closing
 * is never dropped together with the emptied list.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<WavegateEvent>>> observersBySession = new ConcurrentHashMap<>();

    private final List<Consumer<WavegateEvent>> allSessionObservers = new CopyOnWriteArrayList<>();

    public void publish(WavegateEvent event) {
        log.debug("{} -> session {}", event.type().wireName(), event.sessionId());
        List<Consumer<WavegateEvent>> observers = observersBySession.get(event.sessionId());
        if (observers != null) {
            observers.forEach(observer -> deliver(observer, event));
        }
        allSessionObservers.forEach(observer -> deliver(observer, event));
    }

    /**
     * Registers {@code observer} for the events of one session.
     *
     * @return handle that removes the registration; calling it more than once has no effect
     */
    public Subscription subscribe(String sessionId, Consumer<WavegateEvent> observer) {
        observersBySession.compute(sessionId, (key, observers) -> {
            List<Consumer<WavegateEvent>> target = observers == null ? new CopyOnWriteArrayList<>() : observers;
            target.add(observer);
            return target;
        });
        log.debug("Observer attached to session {}", sessionId);

        var active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                observersBySession.computeIfPresent(sessionId, (key, observers) -> {
                    observers.remove(observer);
                    return observers.isEmpty() ? null : observers;
                });
                log.debug("Observer detached from session {}", sessionId);
            }
        };
    }

    /**
     * Registers {@code observer} for the events of every session.
     */
    public Subscription subscribeAll(Consumer<WavegateEvent> observer) {
        allSessionObservers.add(observer);
        return () -> allSessionObservers.remove(observer);
    }

    int subscriberCount(String sessionId) {
        List<Consumer<WavegateEvent>> observers = observersBySession.get(sessionId);
        return observers == null ? 0 : observers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<WavegateEvent> observer, WavegateEvent event) {
        try {
            observer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Observer failed on {} for session {}: {}",
                    event.type().wireName(), event.sessionId(), e.getMessage(), e);
        }
    }
}
