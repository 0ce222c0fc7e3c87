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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.EventHandlingStatus;
import org.tributary.subscription.api.ReceivedEvent;

import static java.util.Objects.requireNonNull;

/**
 * Decorates an {@link EventHandler} and logs the outcome of every invocation. Failures are logged and rethrown.
 */
public class LoggingEventHandler implements EventHandler {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventHandler.class);

    private final EventHandler delegate;

    public LoggingEventHandler(EventHandler delegate) {
        this.delegate = requireNonNull(delegate, EventHandler.class.getSimpleName() + " cannot be null");
    }

    public static EventHandler logging(EventHandler delegate) {
        return new LoggingEventHandler(delegate);
    }

    @Override
    public EventHandlingStatus handle(ReceivedEvent event, CancellationSignal signal) throws Exception {
        long started = System.nanoTime();
        final EventHandlingStatus status;
        try {
            status = delegate.handle(event, signal);
        } catch (Exception e) {
            log.warn("{} failed to handle {} at position {} (retry count {})", delegate.name(), event.eventType(), event.globalPosition(), event.retryCount(), e);
            throw e;
        }
        if (status == EventHandlingStatus.IGNORED) {
            log.trace("{} ignored {} at position {}", delegate.name(), event.eventType(), event.globalPosition());
        } else {
            log.debug("{} handled {} at position {} in {} ms", delegate.name(), event.eventType(), event.globalPosition(), (System.nanoTime() - started) / 1_000_000);
        }
        return status;
    }

    @Override
    public String name() {
        return delegate.name();
    }
}
