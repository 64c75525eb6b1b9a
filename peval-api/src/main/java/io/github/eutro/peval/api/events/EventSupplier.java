package io.github.eutro.peval.api.events;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An {@link EventDispatcher} that can also fire the events it dispatches.
 * <p>
 * Listeners are kept per exact event type. A listener that throws stops the dispatch, and the exception
 * propagates with a suppressed note naming the event and the position of the listener, so that a failure
 * inside a specialization can be traced back to the listener that caused it.
 *
 * @param <S> The type of events that can be listened to or fired.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventSupplier.class);

    private final Map<Class<?>, Listeners<?>> listeners = new ConcurrentHashMap<>();

    private static final class Listeners<T> {
        final List<Consumer<T>> consumers = new CopyOnWriteArrayList<>();

        void fire(Class<T> eventClass, T event) {
            int i = 0;
            for (Consumer<T> consumer : consumers) {
                try {
                    consumer.accept(event);
                } catch (Throwable t) {
                    t.addSuppressed(new RuntimeException("in listener " + i + " of " + eventClass.getSimpleName()));
                    throw t;
                }
                i++;
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Listeners<T> listenersOf(Class<T> eventClass) {
        return (Listeners<T>) listeners.computeIfAbsent(eventClass, $ -> new Listeners<>());
    }

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listenersOf(eventClass).consumers.add(listener);
    }

    /**
     * Check whether anything listens to an event type, so that events nobody sees need not be built.
     *
     * @param eventClass The exact type of the event.
     * @return Whether any listener was added for the type.
     */
    public boolean hasListeners(Class<? extends S> eventClass) {
        Listeners<?> eventListeners = listeners.get(eventClass);
        return eventListeners != null && !eventListeners.consumers.isEmpty();
    }

    /**
     * Fire an event, running every listener of its exact type.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event, which listeners may modify.
     * @param <T>        The type of the event.
     * @return The event, after all listeners have run.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        if (hasListeners(eventClass)) {
            Listeners<T> eventListeners = listenersOf(eventClass);
            LOGGER.trace("dispatching {} to {} listeners", eventClass.getSimpleName(), eventListeners.consumers.size());
            eventListeners.fire(eventClass, event);
        }
        return event;
    }
}
