package io.github.eutro.peval.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Something that partial evaluation events can be listened to on, either a
 * {@link io.github.eutro.peval.api.PartialEvaluator} or one of its
 * {@link io.github.eutro.peval.api.Specialization}s.
 *
 * @param <S> The type of events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Listen to an event type.
     * <p>
     * Listeners are run only when the <i>exact</i> event type is fired, in the order they were added.
     * A listener may modify the event, and later listeners see the modification.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);

    /**
     * Get a dispatcher that listens on every child dispatcher started by this one.
     * <p>
     * A listener added to the returned dispatcher is added to the child of each {@code startEvent}
     * fired afterwards, so it never sees the events of children started before it was added.
     *
     * @param startEvent The event that starts a child, such as {@link RunSpecializationEvent}.
     * @param child      The child started by an event.
     * @param <E>        The type of the starting event.
     * @param <C>        The type of the events of children.
     * @return The dispatcher.
     */
    default <E extends S, C> EventDispatcher<C> children(Class<E> startEvent,
                                                         Function<? super E, ? extends EventDispatcher<C>> child) {
        EventDispatcher<S> parent = this;
        return new EventDispatcher<C>() {
            @Override
            public <T extends C> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                parent.listen(startEvent, evt -> child.apply(evt).listen(eventClass, listener));
            }
        };
    }
}
