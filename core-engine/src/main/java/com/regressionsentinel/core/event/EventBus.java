package com.regressionsentinel.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe channel owned by one engine or framework
 * instance.
 *
 * <p>
 * Handlers registered for a supertype or interface receive every subtype, so
 * subscribing to {@link SentinelEvent} observes everything. Delivery is
 * synchronous on the publishing thread; a handler that throws is logged and
 * does not affect the publisher or other handlers.
 * </p>
 */
public class EventBus {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<?>, List<Handler>> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler for events of the specified type and its subtypes.
     *
     * @param eventType the event class to subscribe to
     * @param handler   invoked with each matching event
     */
    public <T> void subscribe(Class<T> eventType, Consumer<? super T> handler) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(new Handler(handler, event -> handler.accept(eventType.cast(event))));
    }

    /**
     * @return {@code true} if the handler was registered for that type
     */
    public <T> boolean unsubscribe(Class<T> eventType, Consumer<? super T> handler) {
        List<Handler> list = handlers.get(eventType);
        return list != null && list.removeIf(h -> h.subscriber == handler);
    }

    /**
     * Publishes an event to every handler registered for its class, a
     * superclass or an implemented interface.
     *
     * @param event the event; {@code null} is ignored
     */
    public void publish(Object event) {
        if (event == null) {
            return;
        }
        for (Class<?> type : typesOf(event.getClass())) {
            List<Handler> typeHandlers = handlers.get(type);
            if (typeHandlers == null) {
                continue;
            }
            for (Handler handler : typeHandlers) {
                try {
                    handler.invoker.accept(event);
                } catch (RuntimeException e) {
                    LOG.warn("Event handler for {} failed: {}", type.getSimpleName(), e.getMessage(), e);
                }
            }
        }
    }

    /**
     * Forward every event published here to {@code target}.
     */
    public void forwardTo(EventBus target) {
        Objects.requireNonNull(target, "target must not be null");
        subscribe(Object.class, target::publish);
    }

    public void clear() {
        handlers.clear();
    }

    public int getHandlerCount(Class<?> eventType) {
        List<Handler> list = handlers.get(eventType);
        return list != null ? list.size() : 0;
    }

    private static Set<Class<?>> typesOf(Class<?> eventClass) {
        Set<Class<?>> types = new LinkedHashSet<>();
        for (Class<?> c = eventClass; c != null; c = c.getSuperclass()) {
            types.add(c);
            addInterfaces(c, types);
        }
        return types;
    }

    private static void addInterfaces(Class<?> type, Set<Class<?>> types) {
        for (Class<?> iface : type.getInterfaces()) {
            if (types.add(iface)) {
                addInterfaces(iface, types);
            }
        }
    }

    /**
     * @return the event types that currently have handlers
     */
    public Set<Class<?>> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /** A subscribed consumer and the type-checked call that feeds it. */
    private static final class Handler {
        private final Consumer<?> subscriber;
        private final Consumer<Object> invoker;

        Handler(Consumer<?> subscriber, Consumer<Object> invoker) {
            this.subscriber = subscriber;
            this.invoker = invoker;
        }
    }
}
