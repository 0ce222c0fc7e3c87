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

package org.tributary.subscription.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.tributary.subscription.HandlerPipeline;
import org.tributary.subscription.PersistentSubscription;
import org.tributary.subscription.SubscriptionOptions;
import org.tributary.subscription.SubscriptionState;
import org.tributary.subscription.api.Checkpoint;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.EventHandlingStatus;
import org.tributary.subscription.api.EventProcessingFailureHandler;
import org.tributary.subscription.api.PersistentSubscriptionSettings;
import org.tributary.subscription.api.ReceivedEvent;
import org.tributary.subscription.api.StartPosition;
import org.tributary.subscription.api.StreamSelector;
import org.tributary.subscription.api.SubscriptionGap;
import org.tributary.subscription.api.SubscriptionObserver;
import org.tributary.subscription.api.exception.SubscriptionDroppedException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("persistent subscription on the in-memory store")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(20)
public class InMemoryPersistentSubscriptionsTest {
    private static final StreamSelector ORDERS_1 = StreamSelector.stream("orders-1");

    private InMemoryEventLog eventLog;
    private InMemoryPersistentSubscriptions transport;
    private List<PersistentSubscription> subscriptions;

    @BeforeEach
    void event_log_and_transport_are_initialized_before_each_test() {
        eventLog = new InMemoryEventLog();
        transport = new InMemoryPersistentSubscriptions(eventLog);
        subscriptions = new ArrayList<>();
    }

    @AfterEach
    void shutdown() {
        subscriptions.forEach(PersistentSubscription::shutdown);
        transport.shutdown();
    }

    @Test
    void subscription_is_created_on_first_start_and_receives_events_in_order() {
        // Given
        CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
        PersistentSubscription subscription = subscription("sub-A", ORDERS_1, new SubscriptionOptions().withBufferSize(1), recordingTo(received));
        eventLog.append("orders-1", event("OrderCreated"), event("OrderShipped"));

        // When
        subscription.start();
        eventLog.append("orders-1", event("OrderDelivered"));

        // Then
        await().until(received::size, is(3));
        assertAll(
                () -> assertThat(transport.exists(ORDERS_1, "sub-A")).isTrue(),
                () -> assertThat(received).extracting(ReceivedEvent::eventType).containsExactly("OrderCreated", "OrderShipped", "OrderDelivered"),
                () -> assertThat(received).extracting(ReceivedEvent::streamPosition).containsExactly(0L, 1L, 2L),
                () -> assertThat(received).extracting(ReceivedEvent::streamId).containsOnly("orders-1"),
                () -> assertThat(subscription.state()).isEqualTo(SubscriptionState.ATTACHED)
        );
        await().untilAsserted(() -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).hasSize(3));
    }

    @Test
    void events_of_other_streams_are_not_delivered() {
        // Given
        CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
        subscription("sub-A", ORDERS_1, new SubscriptionOptions(), recordingTo(received)).start();

        // When
        eventLog.append("orders-2", event("OrderCreated"));
        eventLog.append("orders-1", event("OrderShipped"));

        // Then
        await().until(received::size, is(1));
        assertThat(received).extracting(ReceivedEvent::eventType).containsExactly("OrderShipped");
    }

    @Test
    void subscription_to_all_receives_events_from_every_stream() {
        // Given
        CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
        subscription("sub-all", StreamSelector.all(), new SubscriptionOptions(), recordingTo(received)).start();

        // When
        eventLog.append("orders-1", event("OrderCreated"));
        eventLog.append("orders-2", event("OrderCreated"));

        // Then
        await().until(received::size, is(2));
        assertThat(received).extracting(ReceivedEvent::streamId).containsExactlyInAnyOrder("orders-1", "orders-2");
    }

    @Test
    void subscription_starting_from_end_only_receives_new_events() {
        // Given
        eventLog.append("orders-1", event("OrderCreated"));
        CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
        SubscriptionOptions options = new SubscriptionOptions().withSettings(new PersistentSubscriptionSettings().startFrom(StartPosition.end()));
        subscription("sub-A", ORDERS_1, options, recordingTo(received)).start();

        // When
        eventLog.append("orders-1", event("OrderShipped"));

        // Then
        await().until(received::size, is(1));
        assertThat(received).extracting(ReceivedEvent::eventType).containsExactly("OrderShipped");
    }

    @Nested
    @DisplayName("when handlers fail")
    class WhenHandlersFail {

        @Test
        void failed_events_are_redelivered_and_parked_after_max_retry_count() {
            // Given
            CopyOnWriteArrayList<Integer> retryCounts = new CopyOnWriteArrayList<>();
            EventHandler failing = (event, signal) -> {
                retryCounts.add(event.retryCount());
                throw new IllegalStateException("expected");
            };
            SubscriptionOptions options = new SubscriptionOptions().withSettings(new PersistentSubscriptionSettings().maxRetryCount(2));
            subscription("sub-A", ORDERS_1, options, failing).start();

            // When
            eventLog.append("orders-1", event("OrderCreated"));

            // Then
            await().untilAsserted(() -> assertThat(transport.parkedEvents(ORDERS_1, "sub-A")).hasSize(1));
            assertAll(
                    () -> assertThat(retryCounts).containsExactly(0, 1, 2),
                    () -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).isEmpty()
            );
        }

        @Test
        void event_whose_handler_throws_an_error_is_nacked_and_never_acked() {
            // Given
            AtomicInteger attempts = new AtomicInteger();
            EventHandler failing = (event, signal) -> {
                attempts.incrementAndGet();
                throw new AssertionError("boom");
            };
            subscription("sub-A", ORDERS_1, new SubscriptionOptions().withFailureHandler(EventProcessingFailureHandler.park()), failing).start();

            // When
            eventLog.append("orders-1", event("Refunded"));

            // Then
            await().untilAsserted(() -> assertThat(transport.parkedEvents(ORDERS_1, "sub-A")).extracting(CloudEvent::getType).containsExactly("Refunded"));
            assertAll(
                    () -> assertThat(attempts).hasValue(1),
                    () -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).isEmpty(),
                    () -> assertThat(transport.inFlightCount(ORDERS_1, "sub-A")).isZero()
            );
        }

        @Test
        void event_is_handled_once_a_redelivery_succeeds() {
            // Given
            AtomicInteger attempts = new AtomicInteger();
            CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
            EventHandler flaky = (event, signal) -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IllegalStateException("expected");
                }
                received.add(event);
                return EventHandlingStatus.HANDLED;
            };
            subscription("sub-A", ORDERS_1, new SubscriptionOptions(), flaky).start();

            // When
            eventLog.append("orders-1", event("OrderCreated"));

            // Then
            await().until(received::size, is(1));
            assertThat(received.get(0).retryCount()).isEqualTo(2);
            await().untilAsserted(() -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).hasSize(1));
        }

        @Test
        void park_failure_handler_parks_failed_events_immediately() {
            // Given
            AtomicInteger attempts = new AtomicInteger();
            EventHandler failing = (event, signal) -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("expected");
            };
            subscription("sub-A", ORDERS_1, new SubscriptionOptions().withFailureHandler(EventProcessingFailureHandler.park()), failing).start();

            // When
            eventLog.append("orders-1", event("OrderCreated"));

            // Then
            await().untilAsserted(() -> assertThat(transport.parkedEvents(ORDERS_1, "sub-A")).hasSize(1));
            assertThat(attempts).hasValue(1);
        }

        @Test
        void parked_events_can_be_replayed() {
            // Given
            AtomicInteger attempts = new AtomicInteger();
            EventHandler failsOnce = (event, signal) -> {
                if (attempts.incrementAndGet() == 1) {
                    throw new IllegalStateException("expected");
                }
                return EventHandlingStatus.HANDLED;
            };
            subscription("sub-A", ORDERS_1, new SubscriptionOptions().withFailureHandler(EventProcessingFailureHandler.park()), failsOnce).start();
            eventLog.append("orders-1", event("OrderCreated"));
            await().untilAsserted(() -> assertThat(transport.parkedEvents(ORDERS_1, "sub-A")).hasSize(1));

            // When
            int replayed = transport.replayParkedEvents(ORDERS_1, "sub-A");

            // Then
            assertThat(replayed).isEqualTo(1);
            await().untilAsserted(() -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).hasSize(1));
            assertThat(transport.parkedEvents(ORDERS_1, "sub-A")).isEmpty();
        }
    }

    @Nested
    @DisplayName("with a buffer size")
    class WithABufferSize {

        @Test
        void at_most_buffer_size_events_are_in_flight_at_the_same_time() {
            // Given
            AtomicInteger inProgress = new AtomicInteger();
            AtomicInteger maxInProgress = new AtomicInteger();
            CountDownLatch release = new CountDownLatch(1);
            CopyOnWriteArrayList<ReceivedEvent> handled = new CopyOnWriteArrayList<>();
            EventHandler blocking = (event, signal) -> {
                maxInProgress.accumulateAndGet(inProgress.incrementAndGet(), Math::max);
                try {
                    release.await(10, TimeUnit.SECONDS);
                } finally {
                    inProgress.decrementAndGet();
                }
                handled.add(event);
                return EventHandlingStatus.HANDLED;
            };
            subscription("sub-A", ORDERS_1, new SubscriptionOptions().withBufferSize(3), blocking).start();

            // When
            for (int i = 0; i < 6; i++) {
                eventLog.append("orders-1", event("OrderCreated"));
            }

            // Then
            await().until(inProgress::get, is(3));
            await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(inProgress::get, is(3));
            assertAll(
                    () -> assertThat(transport.inFlightCount(ORDERS_1, "sub-A")).isEqualTo(3),
                    () -> assertThat(transport.pendingCount(ORDERS_1, "sub-A")).isEqualTo(3),
                    () -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).isEmpty()
            );

            release.countDown();
            await().until(handled::size, is(6));
            await().untilAsserted(() -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).hasSize(6));
            assertThat(maxInProgress).hasValue(3);
        }

        @Test
        void buffer_size_of_one_delivers_events_one_at_a_time() {
            // Given
            AtomicInteger inProgress = new AtomicInteger();
            AtomicInteger maxInProgress = new AtomicInteger();
            CopyOnWriteArrayList<ReceivedEvent> handled = new CopyOnWriteArrayList<>();
            EventHandler slow = (event, signal) -> {
                maxInProgress.accumulateAndGet(inProgress.incrementAndGet(), Math::max);
                Thread.sleep(20);
                inProgress.decrementAndGet();
                handled.add(event);
                return EventHandlingStatus.HANDLED;
            };
            subscription("sub-A", ORDERS_1, new SubscriptionOptions().withBufferSize(1), slow).start();

            // When
            for (int i = 0; i < 5; i++) {
                eventLog.append("orders-1", event("OrderCreated"));
            }

            // Then
            await().until(handled::size, is(5));
            assertThat(maxInProgress).hasValue(1);
        }
    }

    @Nested
    @DisplayName("when the connection is dropped")
    class WhenTheConnectionIsDropped {

        @Test
        void subscription_resubscribes_after_a_network_error_and_keeps_receiving_events() {
            // Given
            CopyOnWriteArrayList<DropReason> drops = new CopyOnWriteArrayList<>();
            CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
            SubscriptionObserver observer = new SubscriptionObserver() {
                @Override
                public void onDropped(String subscriptionId, DropReason reason, Throwable error) {
                    drops.add(reason);
                }
            };
            PersistentSubscription subscription = subscription("sub-A", ORDERS_1, new SubscriptionOptions().withObserver(observer), recordingTo(received));
            subscription.start();

            // When
            transport.dropConnections(ORDERS_1, "sub-A", DropReason.NETWORK_ERROR, new RuntimeException("connection reset"));

            // Then
            await().untilAsserted(() -> assertThat(drops).containsExactly(DropReason.NETWORK_ERROR));
            await().until(subscription::state, is(SubscriptionState.ATTACHED));
            await().until(() -> transport.connectionCount(ORDERS_1, "sub-A"), is(1));

            eventLog.append("orders-1", event("OrderCreated"));
            await().until(received::size, is(1));
        }

        @Test
        void deleted_subscription_is_recreated() {
            // Given
            CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
            SubscriptionOptions options = new SubscriptionOptions().withSettings(new PersistentSubscriptionSettings().startFrom(StartPosition.end()));
            PersistentSubscription subscription = subscription("sub-A", ORDERS_1, options, recordingTo(received));
            subscription.start();

            // When
            transport.deleteSubscription(ORDERS_1, "sub-A");

            // Then
            await().until(() -> transport.exists(ORDERS_1, "sub-A"), is(true));
            await().until(subscription::state, is(SubscriptionState.ATTACHED));

            eventLog.append("orders-1", event("OrderCreated"));
            await().until(received::size, is(1));
        }

        @Test
        void subscription_fails_when_the_store_shuts_down_and_resubscribing_is_impossible() {
            // Given
            CopyOnWriteArrayList<SubscriptionDroppedException> fatalErrors = new CopyOnWriteArrayList<>();
            SubscriptionObserver observer = new SubscriptionObserver() {
                @Override
                public void onFatalError(SubscriptionDroppedException exception) {
                    fatalErrors.add(exception);
                }
            };
            CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
            PersistentSubscription subscription = subscription("sub-A", ORDERS_1, new SubscriptionOptions().withObserver(observer).withBufferSize(1), recordingTo(received));
            subscription.start();
            eventLog.append("orders-1", event("OrderCreated"), event("OrderShipped"));
            await().until(received::size, is(2));

            // When
            transport.shutdown();

            // Then
            await().until(subscription::state, is(SubscriptionState.FAILED));
            assertThat(fatalErrors).hasSize(1);
            assertAll(
                    () -> assertThat(fatalErrors.get(0).getReason()).isEqualTo(DropReason.SERVER_SHUTDOWN),
                    () -> assertThat(fatalErrors.get(0).getLastKnownPosition()).isEqualTo(1L),
                    () -> assertThat(fatalErrors.get(0).getSubscriptionId()).isEqualTo("sub-A")
            );
        }
    }

    @Nested
    @DisplayName("when stopped")
    class WhenStopped {

        @Test
        void stopping_closes_the_connection_and_the_cursor_is_kept_for_the_next_start() {
            // Given
            CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
            PersistentSubscription subscription = subscription("sub-A", ORDERS_1, new SubscriptionOptions().withBufferSize(1), recordingTo(received));
            subscription.start();
            eventLog.append("orders-1", event("OrderCreated"));
            await().until(received::size, is(1));
            await().untilAsserted(() -> assertThat(transport.acknowledgedEvents(ORDERS_1, "sub-A")).hasSize(1));

            // When
            subscription.stop();
            eventLog.append("orders-1", event("OrderShipped"));

            // Then
            assertAll(
                    () -> assertThat(subscription.state()).isEqualTo(SubscriptionState.STOPPED),
                    () -> assertThat(transport.connectionCount(ORDERS_1, "sub-A")).isZero()
            );

            subscription.start();
            await().until(received::size, is(2));
            assertThat(received).extracting(ReceivedEvent::eventType).containsExactly("OrderCreated", "OrderShipped");
        }

        @Test
        void stopping_twice_does_nothing_the_second_time() {
            // Given
            PersistentSubscription subscription = subscription("sub-A", ORDERS_1, new SubscriptionOptions(), (event, signal) -> EventHandlingStatus.HANDLED);
            subscription.start();

            // When
            subscription.stop();
            subscription.stop();

            // Then
            assertThat(subscription.state()).isEqualTo(SubscriptionState.STOPPED);
        }
    }

    @Test
    void competing_subscriptions_with_the_same_id_share_the_events() {
        // Given
        CopyOnWriteArrayList<ReceivedEvent> received1 = new CopyOnWriteArrayList<>();
        CopyOnWriteArrayList<ReceivedEvent> received2 = new CopyOnWriteArrayList<>();
        subscription("sub-A", ORDERS_1, new SubscriptionOptions(), recordingTo(received1)).start();
        subscription("sub-A", ORDERS_1, new SubscriptionOptions(), recordingTo(received2)).start();

        // When
        for (int i = 0; i < 20; i++) {
            eventLog.append("orders-1", event("OrderCreated"));
        }

        // Then
        await().until(() -> received1.size() + received2.size(), is(20));
        List<String> all = new ArrayList<>();
        received1.forEach(e -> all.add(e.eventId()));
        received2.forEach(e -> all.add(e.eventId()));
        assertAll(
                () -> assertThat(all).doesNotHaveDuplicates(),
                () -> assertThat(transport.connectionCount(ORDERS_1, "sub-A")).isEqualTo(2)
        );
    }

    @Test
    void checkpoints_are_stored_for_handled_events() {
        // Given
        InMemoryCheckpointStore checkpointStore = new InMemoryCheckpointStore();
        CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
        subscription("sub-A", ORDERS_1, new SubscriptionOptions().withCheckpointStore(checkpointStore), recordingTo(received)).start();

        // When
        eventLog.append("orders-2", event("OrderCreated"));
        eventLog.append("orders-1", event("OrderCreated"), event("OrderShipped"));

        // Then
        await().until(received::size, is(2));
        await().until(() -> checkpointStore.load("sub-A"), is(new Checkpoint("sub-A", 2L)));
    }

    @Test
    void gap_is_zero_when_subscription_has_caught_up_with_the_tip() {
        // Given
        CopyOnWriteArrayList<ReceivedEvent> received = new CopyOnWriteArrayList<>();
        PersistentSubscription subscription = subscription("sub-all", StreamSelector.all(), new SubscriptionOptions(), recordingTo(received));
        subscription.start();
        eventLog.append("orders-1", event("OrderCreated"), event("OrderShipped"));
        await().until(received::size, is(2));

        // When
        SubscriptionGap gap = subscription.measureGap().orElseThrow();

        // Then
        assertAll(
                () -> assertThat(gap.gap()).isZero(),
                () -> assertThat(gap.lastSeenPosition()).isEqualTo(1L),
                () -> assertThat(gap.tipPosition()).isEqualTo(1L),
                () -> assertThat(gap.stale()).isFalse()
        );
    }

    private PersistentSubscription subscription(String subscriptionId, StreamSelector selector, SubscriptionOptions options, EventHandler... handlers) {
        PersistentSubscription subscription = new PersistentSubscription(subscriptionId, selector, transport, eventLog, new HandlerPipeline(subscriptionId, handlers), options);
        subscriptions.add(subscription);
        return subscription;
    }

    private static EventHandler recordingTo(List<ReceivedEvent> received) {
        return (event, signal) -> {
            received.add(event);
            return EventHandlingStatus.HANDLED;
        };
    }

    private static CloudEvent event(String type) {
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(URI.create("urn:tributary:test"))
                .withType(type)
                .withData("application/json", "{}".getBytes(UTF_8))
                .build();
    }
}
