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

import io.cloudevents.CloudEvent;

import static java.util.Objects.requireNonNull;

/**
 * Decides what to tell the store about an event that failed processing.
 */
@FunctionalInterface
public interface EventProcessingFailureHandler {

    /**
     * @param connection The connection the event was delivered on
     * @param event      The wire event
     * @param error      The cause of the failure
     */
    void onFailure(LiveConnection connection, CloudEvent event, Throwable error);

    /**
     * Nack the event with {@link NackAction#RETRY}, this is the default.
     */
    static EventProcessingFailureHandler retry() {
        return nack(NackAction.RETRY);
    }

    /**
     * Nack the event with {@link NackAction#PARK}
     */
    static EventProcessingFailureHandler park() {
        return nack(NackAction.PARK);
    }

    /**
     * Nack the event with {@link NackAction#SKIP}
     */
    static EventProcessingFailureHandler skip() {
        return nack(NackAction.SKIP);
    }

    static EventProcessingFailureHandler nack(NackAction action) {
        requireNonNull(action, NackAction.class.getSimpleName() + " cannot be null");
        return (connection, event, error) -> connection.nack(action, reasonOf(error), event);
    }

    static String reasonOf(Throwable error) {
        Throwable cause = error.getCause() == null ? error : error.getCause();
        return cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    }
}
