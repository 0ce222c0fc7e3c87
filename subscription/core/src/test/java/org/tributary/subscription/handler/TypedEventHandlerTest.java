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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.EventHandlingStatus;
import org.tributary.subscription.api.EventSerializer;
import org.tributary.subscription.api.ReceivedEvent;
import org.tributary.subscription.api.exception.SerializationException;

import java.time.OffsetDateTime;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.tributary.subscription.handler.LoggingEventHandler.logging;

@DisplayName("typed event handler")
@DisplayNameGeneration(ReplaceUnderscores.class)
class TypedEventHandlerTest {

    interface OrderEvent {
    }

    record OrderCreated(String orderId) implements OrderEvent {
    }

    record OrderShipped(String orderId) implements OrderEvent {
    }

    // Payload is the order id, the event type decides the class
    private static final EventSerializer SERIALIZER = new EventSerializer() {
        @Override
        public Object deserialize(byte[] data, String eventType) {
            String orderId = new String(data, UTF_8);
            switch (eventType) {
                case "OrderCreated":
                    return new OrderCreated(orderId);
                case "OrderShipped":
                    return new OrderShipped(orderId);
                case "Corrupt":
                    throw new SerializationException(eventType, new IllegalArgumentException("corrupt"));
                default:
                    return null;
            }
        }

        @Override
        public SerializedEvent serialize(Object event) {
            throw new UnsupportedOperationException();
        }
    };

    private final CopyOnWriteArrayList<Object> handled = new CopyOnWriteArrayList<>();

    @Test
    void dispatches_payload_to_the_handler_registered_for_its_class() throws Exception {
        // Given
        TypedEventHandler handler = new TypedEventHandler("order-projection", SERIALIZER)
                .on(OrderCreated.class, (payload, event) -> handled.add(payload))
                .on(OrderShipped.class, (payload, event) -> handled.add("shipped " + payload.orderId()));

        // When
        EventHandlingStatus created = handler.handle(event("OrderCreated", "o1"), CancellationSignal.never());
        EventHandlingStatus shipped = handler.handle(event("OrderShipped", "o1"), CancellationSignal.never());

        // Then
        assertAll(
                () -> assertThat(created).isEqualTo(EventHandlingStatus.HANDLED),
                () -> assertThat(shipped).isEqualTo(EventHandlingStatus.HANDLED),
                () -> assertThat(handled).containsExactly(new OrderCreated("o1"), "shipped o1")
        );
    }

    @Test
    void handler_registered_for_a_super_type_receives_sub_types() throws Exception {
        // Given
        TypedEventHandler handler = new TypedEventHandler("order-projection", SERIALIZER).on(OrderEvent.class, (payload, event) -> handled.add(payload));

        // When
        EventHandlingStatus status = handler.handle(event("OrderShipped", "o2"), CancellationSignal.never());

        // Then
        assertThat(status).isEqualTo(EventHandlingStatus.HANDLED);
        assertThat(handled).containsExactly(new OrderShipped("o2"));
    }

    @Test
    void ignores_unknown_undeserializable_and_unhandled_events() throws Exception {
        // Given
        TypedEventHandler handler = new TypedEventHandler("order-projection", SERIALIZER).on(OrderCreated.class, (payload, event) -> handled.add(payload));

        // When
        EventHandlingStatus unknown = handler.handle(event("OrderAudited", "o1"), CancellationSignal.never());
        EventHandlingStatus corrupt = handler.handle(event("Corrupt", "o1"), CancellationSignal.never());
        EventHandlingStatus unhandled = handler.handle(event("OrderShipped", "o1"), CancellationSignal.never());

        // Then
        assertAll(
                () -> assertThat(unknown).isEqualTo(EventHandlingStatus.IGNORED),
                () -> assertThat(corrupt).isEqualTo(EventHandlingStatus.IGNORED),
                () -> assertThat(unhandled).isEqualTo(EventHandlingStatus.IGNORED),
                () -> assertThat(handled).isEmpty()
        );
    }

    @Test
    void registering_two_handlers_for_the_same_class_is_rejected() {
        // Given
        TypedEventHandler handler = new TypedEventHandler("order-projection", SERIALIZER).on(OrderCreated.class, (payload, event) -> handled.add(payload));

        // When
        Throwable throwable = catchThrowable(() -> handler.on(OrderCreated.class, (payload, event) -> handled.add(payload)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void logging_decorator_keeps_the_name_and_rethrows_failures() {
        // Given
        EventHandler failing = logging(EventHandler.named("failing", (event, signal) -> {
            throw new IllegalStateException("expected");
        }));

        // When
        Throwable throwable = catchThrowable(() -> failing.handle(event("OrderCreated", "o1"), CancellationSignal.never()));

        // Then
        assertAll(
                () -> assertThat(failing.name()).isEqualTo("failing"),
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("expected")
        );
    }

    private static ReceivedEvent event(String eventType, String payload) {
        return new ReceivedEvent("e-" + eventType, 0, "orders-1", 0, 0, eventType, OffsetDateTime.of(2026, 10, 18, 12, 0, 0, 0, UTC),
                payload.getBytes(UTF_8), new byte[0], 0);
    }
}
