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

import static java.util.Objects.requireNonNull;

/**
 * The aggregated outcome of running all handlers for one event.
 */
public sealed interface DeliveryOutcome {

    static DeliveryOutcome handled() {
        return Handled.INSTANCE;
    }

    static DeliveryOutcome ignored() {
        return Ignored.INSTANCE;
    }

    static DeliveryOutcome failed(Throwable error) {
        return new Failed(error);
    }

    /**
     * @return {@code true} if the event should be acknowledged
     */
    default boolean isSuccessful() {
        return !(this instanceof Failed);
    }

    record Handled() implements DeliveryOutcome {
        private static final Handled INSTANCE = new Handled();
    }

    record Ignored() implements DeliveryOutcome {
        private static final Ignored INSTANCE = new Ignored();
    }

    record Failed(Throwable error) implements DeliveryOutcome {
        public Failed {
            requireNonNull(error, "error cannot be null");
        }
    }
}
