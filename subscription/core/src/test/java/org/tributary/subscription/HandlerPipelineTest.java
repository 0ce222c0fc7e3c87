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

package org.tributary.subscription;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.DeliveryOutcome;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.EventHandlingStatus;
import org.tributary.subscription.api.ReceivedEvent;
import org.tributary.subscription.api.exception.EventHandlerException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.tributary.subscription.WireEvents.receivedEvent;
import static org.tributary.subscription.api.EventHandler.named;
import static org.tributary.subscription.api.EventHandlingStatus.HANDLED;
import static org.tributary.subscription.api.EventHandlingStatus.IGNORED;

@DisplayName("Handler Pipeline")
@DisplayNameGeneration(ReplaceUnderscores.class)
class HandlerPipelineTest {

    @Test
    void outcome_is_handled_when_at_least_one_handler_handles_the_event() {
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", (e, s) -> IGNORED, (e, s) -> HANDLED);

        DeliveryOutcome outcome = pipeline.handle(receivedEvent("Created", 0), CancellationSignal.never());

        assertThat(outcome).isEqualTo(DeliveryOutcome.handled());
    }

    @Test
    void outcome_is_ignored_when_all_handlers_ignore_the_event() {
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", (e, s) -> IGNORED, (e, s) -> IGNORED);

        DeliveryOutcome outcome = pipeline.handle(receivedEvent("Created", 0), CancellationSignal.never());

        assertThat(outcome).isEqualTo(DeliveryOutcome.ignored());
    }

    @Test
    void outcome_is_ignored_when_there_are_no_handlers() {
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", List.of());

        DeliveryOutcome outcome = pipeline.handle(receivedEvent("Created", 0), CancellationSignal.never());

        assertThat(outcome).isEqualTo(DeliveryOutcome.ignored());
    }

    @Test
    void first_failing_handler_stops_the_chain_and_is_named_in_the_failure() {
        // Given
        CopyOnWriteArrayList<String> invoked = new CopyOnWriteArrayList<>();
        EventHandler h1 = named("H1", (e, s) -> {
            invoked.add("H1");
            return HANDLED;
        });
        EventHandler h2 = named("H2", (e, s) -> {
            invoked.add("H2");
            throw new IllegalStateException("boom");
        });
        EventHandler h3 = named("H3", (e, s) -> {
            invoked.add("H3");
            return HANDLED;
        });
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", h1, h2, h3);

        // When
        DeliveryOutcome outcome = pipeline.handle(receivedEvent("Refunded", 1), CancellationSignal.never());

        // Then
        assertThat(invoked).containsExactly("H1", "H2");
        assertThat(outcome).isInstanceOf(DeliveryOutcome.Failed.class);
        Throwable error = ((DeliveryOutcome.Failed) outcome).error();
        assertAll(
                () -> assertThat(error).isExactlyInstanceOf(EventHandlerException.class).hasRootCauseMessage("boom"),
                () -> assertThat(((EventHandlerException) error).getHandlerName()).isEqualTo("H2"),
                () -> assertThat(((EventHandlerException) error).getEventType()).isEqualTo("Refunded"),
                () -> assertThat(((EventHandlerException) error).getSubscriptionId()).isEqualTo("sub-A")
        );
    }

    @Test
    void error_thrown_by_a_handler_is_a_failure_of_that_handler() {
        // Given
        CopyOnWriteArrayList<String> invoked = new CopyOnWriteArrayList<>();
        EventHandler h1 = named("H1", (e, s) -> {
            invoked.add("H1");
            throw new AssertionError("boom");
        });
        EventHandler h2 = named("H2", (e, s) -> {
            invoked.add("H2");
            return HANDLED;
        });
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", h1, h2);

        // When
        DeliveryOutcome outcome = pipeline.handle(receivedEvent("Refunded", 1), CancellationSignal.never());

        // Then
        assertThat(invoked).containsExactly("H1");
        assertThat(outcome).isInstanceOf(DeliveryOutcome.Failed.class);
        Throwable error = ((DeliveryOutcome.Failed) outcome).error();
        assertAll(
                () -> assertThat(error).isExactlyInstanceOf(EventHandlerException.class),
                () -> assertThat(error).hasCauseExactlyInstanceOf(AssertionError.class),
                () -> assertThat(((EventHandlerException) error).getHandlerName()).isEqualTo("H1")
        );
    }

    @Test
    void h1_and_h2_produce_handled_failed_handled_for_created_refunded_shipped() {
        // Given
        CopyOnWriteArrayList<String> seenByH1 = new CopyOnWriteArrayList<>();
        EventHandler h1 = named("H1", (e, s) -> {
            seenByH1.add(e.eventType());
            return HANDLED;
        });
        EventHandler h2 = named("H2", (e, s) -> {
            if (e.eventType().equals("Refunded")) {
                throw new IllegalStateException("Refunds are not supported");
            }
            return HANDLED;
        });
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", h1, h2);

        // When
        List<DeliveryOutcome> outcomes = List.of(
                pipeline.handle(receivedEvent("Created", 0), CancellationSignal.never()),
                pipeline.handle(receivedEvent("Refunded", 1), CancellationSignal.never()),
                pipeline.handle(receivedEvent("Shipped", 2), CancellationSignal.never()));

        // Then
        assertAll(
                () -> assertThat(outcomes).extracting(outcome -> outcome.getClass().getSimpleName()).containsExactly("Handled", "Failed", "Handled"),
                () -> assertThat(seenByH1).containsExactly("Created", "Refunded", "Shipped")
        );
    }

    @Test
    void no_handler_is_invoked_when_the_signal_is_cancelled() {
        // Given
        CopyOnWriteArrayList<ReceivedEvent> invoked = new CopyOnWriteArrayList<>();
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", (e, s) -> {
            invoked.add(e);
            return HANDLED;
        });
        SubscriptionLifetime lifetime = new SubscriptionLifetime();
        lifetime.cancel();

        // When
        DeliveryOutcome outcome = pipeline.handle(receivedEvent("Created", 0), lifetime);

        // Then
        assertAll(
                () -> assertThat(invoked).isEmpty(),
                () -> assertThat(outcome).isInstanceOf(DeliveryOutcome.Failed.class),
                () -> assertThat(((DeliveryOutcome.Failed) outcome).error()).isInstanceOf(CancellationException.class)
        );
    }

    @Test
    void handler_status_of_a_handler_returning_normally_is_never_failed() {
        HandlerPipeline pipeline = new HandlerPipeline("sub-A", (e, s) -> EventHandlingStatus.HANDLED);

        assertThat(pipeline.handle(receivedEvent("Created", 0), CancellationSignal.never()).isSuccessful()).isTrue();
    }
}
