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

import io.cloudevents.CloudEvent;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.Checkpoint;
import org.tributary.subscription.api.DeliveryOutcome;
import org.tributary.subscription.api.LiveConnection;
import org.tributary.subscription.api.NackAction;
import org.tributary.subscription.api.ReceivedEvent;

import static java.util.Objects.requireNonNull;

/**
 * Processes each event delivered by the transport: maps it, records its position, runs the {@link HandlerPipeline} and
 * acks or nacks it. Invoked concurrently from the transport's worker threads and never throws.
 */
@NullMarked
public class EventDeliveryLoop {
    private static final Logger log = LoggerFactory.getLogger(EventDeliveryLoop.class);

    private final String subscriptionId;
    private final HandlerPipeline pipeline;
    private final SubscriptionGapMeasure gapMeasure;
    private final SubscriptionOptions options;

    public EventDeliveryLoop(String subscriptionId, HandlerPipeline pipeline, SubscriptionGapMeasure gapMeasure, SubscriptionOptions options) {
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
        this.pipeline = requireNonNull(pipeline, HandlerPipeline.class.getSimpleName() + " cannot be null");
        this.gapMeasure = requireNonNull(gapMeasure, SubscriptionGapMeasure.class.getSimpleName() + " cannot be null");
        this.options = requireNonNull(options, SubscriptionOptions.class.getSimpleName() + " cannot be null");
    }

    /**
     * Deliver one event.
     *
     * @param connection The connection the event was received on, used for ack and nack
     * @param cloudEvent The wire event
     * @param retryCount The number of times the store has redelivered the event
     * @param signal     Cancelled when the attachment that received the event is stopped, in which case the event is neither acked nor nacked
     */
    public void deliver(LiveConnection connection, CloudEvent cloudEvent, int retryCount, CancellationSignal signal) {
        try {
            deliverOrThrow(connection, cloudEvent, retryCount, signal);
        } catch (Throwable e) {
            log.error("Unexpected error when delivering event {} to subscription {}", cloudEvent.getId(), subscriptionId, e);
        }
    }

    private void deliverOrThrow(LiveConnection connection, CloudEvent cloudEvent, int retryCount, CancellationSignal signal) {
        final ReceivedEvent event;
        try {
            event = ReceivedEvents.fromCloudEvent(cloudEvent, retryCount);
        } catch (RuntimeException e) {
            log.warn("Skipping event {} of type {} in subscription {} since it cannot be mapped", cloudEvent.getId(), cloudEvent.getType(), subscriptionId, e);
            if (!signal.isCancelled()) {
                connection.nack(NackAction.SKIP, "Unmappable event: " + e.getMessage(), cloudEvent);
            }
            return;
        }

        gapMeasure.record(event.globalPosition());
        DeliveryOutcome outcome = pipeline.handle(event, signal);

        if (signal.isCancelled()) {
            log.debug("Subscription {} was stopped while handling event {}, leaving it to be redelivered", subscriptionId, event.eventId());
            return;
        }

        if (outcome instanceof DeliveryOutcome.Failed failed) {
            log.debug("Event {} at position {} failed in subscription {} (retry count {})", event.eventId(), event.globalPosition(), subscriptionId, retryCount, failed.error());
            try {
                options.failureHandler().onFailure(connection, cloudEvent, failed.error());
            } catch (RuntimeException e) {
                log.error("Failure handler of subscription {} failed for event {}", subscriptionId, event.eventId(), e);
            }
            return;
        }

        if (!options.autoAck()) {
            connection.ack(cloudEvent);
        }
        log.debug("Event {} of type {} at position {} {} by subscription {}", event.eventId(), event.eventType(), event.globalPosition(),
                outcome instanceof DeliveryOutcome.Ignored ? "ignored" : "handled", subscriptionId);
        try {
            options.checkpointStore().store(new Checkpoint(subscriptionId, event.globalPosition()));
        } catch (RuntimeException e) {
            log.warn("Failed to store checkpoint {} for subscription {}", event.globalPosition(), subscriptionId, e);
        }
    }
}
