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

import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * How far a subscription lags behind the tip of the log.
 *
 * @param subscriptionId   The subscription
 * @param gap              The number of positions between the last seen event and the tip, never negative
 * @param lastSeenPosition The global position of the last event seen by the subscription, {@code null} if none
 * @param tipPosition      The global position of the last event in the log, {@code null} if the log is empty
 * @param measuredAt       When the tip was read
 * @param stale            {@code true} if the tip could not be read and this is a previous measurement
 */
public record SubscriptionGap(String subscriptionId, long gap, @Nullable Long lastSeenPosition, @Nullable Long tipPosition, Instant measuredAt, boolean stale) {

    public SubscriptionGap {
        requireNonNull(subscriptionId, "subscriptionId cannot be null");
        requireNonNull(measuredAt, "measuredAt cannot be null");
        if (gap < 0) {
            throw new IllegalArgumentException("gap cannot be negative");
        }
    }

    public SubscriptionGap asStale() {
        return stale ? this : new SubscriptionGap(subscriptionId, gap, lastSeenPosition, tipPosition, measuredAt, true);
    }
}
