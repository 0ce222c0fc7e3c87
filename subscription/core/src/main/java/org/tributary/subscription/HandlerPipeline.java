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

import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.DeliveryOutcome;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.EventHandlingStatus;
import org.tributary.subscription.api.ReceivedEvent;
import org.tributary.subscription.api.exception.EventHandlerException;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

import static java.util.Objects.requireNonNull;

/**
 * An ordered chain of {@link EventHandler}s that are invoked one after the other for each event.
 * <p>
 * The first handler that throws stops the chain for that event and the outcome is {@link DeliveryOutcome.Failed}, handlers that
 * ran before it are not rolled back. This includes {@link Error}s such as a failed assertion or a missing class, so that a
 * failing handler always leads to a nack and never to an ack. If all handlers return, the outcome is {@link DeliveryOutcome.Ignored} if every handler
 * ignored the event (or if there are no handlers) and {@link DeliveryOutcome.Handled} otherwise.
 * </p>
 * <p>
 * The pipeline holds no per-event state and can be shared by concurrent deliveries of the same subscription.
 * </p>
 */
@NullMarked
public class HandlerPipeline {
    private static final Logger log = LoggerFactory.getLogger(HandlerPipeline.class);

    private final String subscriptionId;
    private final List<EventHandler> handlers;

    public HandlerPipeline(String subscriptionId, EventHandler... handlers) {
        this(subscriptionId, Arrays.asList(requireNonNull(handlers, "handlers cannot be null")));
    }

    public HandlerPipeline(String subscriptionId, List<EventHandler> handlers) {
        requireNonNull(subscriptionId, "subscriptionId cannot be null");
        requireNonNull(handlers, "handlers cannot be null");
        handlers.forEach(handler -> requireNonNull(handler, EventHandler.class.getSimpleName() + " cannot be null"));
        this.subscriptionId = subscriptionId;
        this.handlers = List.copyOf(handlers);
    }

    public DeliveryOutcome handle(ReceivedEvent event, CancellationSignal signal) {
        requireNonNull(event, ReceivedEvent.class.getSimpleName() + " cannot be null");
        requireNonNull(signal, CancellationSignal.class.getSimpleName() + " cannot be null");
        boolean handledByAny = false;
        for (EventHandler handler : handlers) {
            if (signal.isCancelled()) {
                log.debug("Subscription {} was stopped before {} handled event {}", subscriptionId, handler.name(), event.eventId());
                return DeliveryOutcome.failed(new CancellationException("Subscription " + subscriptionId + " was stopped"));
            }

            final EventHandlingStatus status;
            try {
                status = handler.handle(event, signal);
            } catch (Throwable e) {
                log.debug("Handler {} of subscription {} failed on event {}", handler.name(), subscriptionId, event.eventId(), e);
                return DeliveryOutcome.failed(new EventHandlerException(subscriptionId, handler.name(), event.eventType(), e));
            }

            if (status != EventHandlingStatus.IGNORED) {
                handledByAny = true;
            }
        }
        return handledByAny ? DeliveryOutcome.handled() : DeliveryOutcome.ignored();
    }

    public List<EventHandler> handlers() {
        return handlers;
    }
}
