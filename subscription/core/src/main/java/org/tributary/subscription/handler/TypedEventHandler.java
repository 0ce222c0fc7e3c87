/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.subscription.handler;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.EventHandlingStatus;
import org.tributary.subscription.api.EventSerializer;
import org.tributary.subscription.api.ReceivedEvent;
import org.tributary.subscription.api.exception.SerializationException;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * An {@link EventHandler} that deserializes the payload with an {@link EventSerializer} and dispatches it to the handler registered
 * for its class. Events of unknown types, events that can't be deserialized and events without a registered handler are ignored.
 * <pre>
 * EventHandler handler = new TypedEventHandler("order-projection", serializer)
 *         .on(OrderCreated.class, (orderCreated, event) -&gt; orders.add(orderCreated.orderId()))
 *         .on(OrderShipped.class, (orderShipped, event) -&gt; orders.ship(orderShipped.orderId()));
 * </pre>
 */
@NullMarked
public class TypedEventHandler implements EventHandler {
    private static final Logger log = LoggerFactory.getLogger(TypedEventHandler.class);

    @FunctionalInterface
    public interface TypedHandler<T> {
        void handle(T payload, ReceivedEvent event) throws Exception;
    }

    private final String name;
    private final EventSerializer serializer;
    private final Map<Class<?>, TypedHandler<?>> handlers;

    public TypedEventHandler(String name, EventSerializer serializer) {
        this(name, serializer, Map.of());
    }

    private TypedEventHandler(String name, EventSerializer serializer, Map<Class<?>, TypedHandler<?>> handlers) {
        this.name = requireNonNull(name, "name cannot be null");
        this.serializer = requireNonNull(serializer, EventSerializer.class.getSimpleName() + " cannot be null");
        this.handlers = handlers;
    }

    /**
     * @return A new {@code TypedEventHandler} that also handles payloads of the given type
     */
    public <T> TypedEventHandler on(Class<T> type, TypedHandler<? super T> handler) {
        requireNonNull(type, "type cannot be null");
        requireNonNull(handler, TypedHandler.class.getSimpleName() + " cannot be null");
        if (handlers.containsKey(type)) {
            throw new IllegalArgumentException("A handler for " + type.getName() + " is already registered in " + name);
        }
        Map<Class<?>, TypedHandler<?>> copy = new LinkedHashMap<>(handlers);
        copy.put(type, handler);
        return new TypedEventHandler(name, serializer, unmodifiableMap(copy));
    }

    @Override
    public EventHandlingStatus handle(ReceivedEvent event, CancellationSignal signal) throws Exception {
        final Object payload;
        try {
            payload = serializer.deserialize(event.data(), event.eventType());
        } catch (SerializationException e) {
            log.warn("{} ignores event {} since its payload of type {} cannot be deserialized", name, event.eventId(), event.eventType(), e);
            return EventHandlingStatus.IGNORED;
        }

        if (payload == null) {
            return EventHandlingStatus.IGNORED;
        }

        TypedHandler<Object> handler = findHandler(payload.getClass());
        if (handler == null) {
            return EventHandlingStatus.IGNORED;
        }
        handler.handle(payload, event);
        return EventHandlingStatus.HANDLED;
    }

    @SuppressWarnings("unchecked")
    private @Nullable TypedHandler<Object> findHandler(Class<?> payloadType) {
        TypedHandler<?> handler = handlers.get(payloadType);
        if (handler == null) {
            handler = handlers.entrySet().stream()
                    .filter(entry -> entry.getKey().isAssignableFrom(payloadType))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
        return (TypedHandler<Object>) handler;
    }

    @Override
    public String name() {
        return name;
    }
}
