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

package org.tributary.subscription.api;

import org.jspecify.annotations.NullMarked;

import static java.util.Objects.requireNonNull;

/**
 * An application level handler that is invoked for each event delivered by a persistent subscription.
 * Throwing an exception means that the event failed, which will eventually lead to a nack.
 */
@NullMarked
@FunctionalInterface
public interface EventHandler {

    /**
     * Handle the event.
     *
     * @param event  The event
     * @param signal Cancelled when the subscription delivering the event is stopped
     * @return {@link EventHandlingStatus#HANDLED} or {@link EventHandlingStatus#IGNORED} if the handler has no interest in this event
     * @throws Exception If the event could not be handled
     */
    EventHandlingStatus handle(ReceivedEvent event, CancellationSignal signal) throws Exception;

    /**
     * @return The name of the handler, used when reporting failures and in logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Give a handler, typically a lambda, a name.
     */
    static EventHandler named(String name, EventHandler handler) {
        requireNonNull(name, "name cannot be null");
        requireNonNull(handler, EventHandler.class.getSimpleName() + " cannot be null");
        return new EventHandler() {
            @Override
            public EventHandlingStatus handle(ReceivedEvent event, CancellationSignal signal) throws Exception {
                return handler.handle(event, signal);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
