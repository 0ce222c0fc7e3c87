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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.EventPosition;
import org.tributary.subscription.api.LogTipReader;
import org.tributary.subscription.api.SubscriptionGap;
import org.tributary.subscription.api.SubscriptionObserver;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Keeps track of the highest global position a subscription has seen and measures how far it lags behind the tip of the log.
 * <p>
 * Gap is {@code tip - lastSeen}, never negative. Before any event is seen positions are counted from the start of the log,
 * so the gap is {@code tip + 1}. An empty log has no gap.
 * </p>
 */
public class SubscriptionGapMeasure {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionGapMeasure.class);
    private static final long NOTHING_SEEN = -1;

    private final String subscriptionId;
    private final LogTipReader logTipReader;
    private final SubscriptionObserver observer;
    private final Clock clock;

    private final AtomicLong lastSeenPosition = new AtomicLong(NOTHING_SEEN);
    private final AtomicReference<SubscriptionGap> lastMeasurement = new AtomicReference<>();

    public SubscriptionGapMeasure(String subscriptionId, LogTipReader logTipReader, SubscriptionObserver observer) {
        this(subscriptionId, logTipReader, observer, Clock.systemUTC());
    }

    public SubscriptionGapMeasure(String subscriptionId, LogTipReader logTipReader, SubscriptionObserver observer, Clock clock) {
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
        this.logTipReader = requireNonNull(logTipReader, LogTipReader.class.getSimpleName() + " cannot be null");
        this.observer = requireNonNull(observer, SubscriptionObserver.class.getSimpleName() + " cannot be null");
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    /**
     * Record that the subscription has seen the given position. Lower positions than the highest seen so far, from redeliveries
     * or concurrent deliveries, don't move the position back.
     */
    public void record(long globalPosition) {
        if (globalPosition < 0) {
            throw new IllegalArgumentException("globalPosition cannot be negative");
        }
        lastSeenPosition.accumulateAndGet(globalPosition, Math::max);
    }

    public OptionalLong lastSeenPosition() {
        long position = lastSeenPosition.get();
        return position == NOTHING_SEEN ? OptionalLong.empty() : OptionalLong.of(position);
    }

    /**
     * Read the tip of the log and compute the gap. The measurement is published to the {@link SubscriptionObserver}.
     *
     * @return The measured gap. If the tip couldn't be read, the previous measurement flagged as stale, or empty if there is none.
     */
    public Optional<SubscriptionGap> measure() {
        final EventPosition tip;
        try {
            tip = logTipReader.readLastEventPosition();
        } catch (RuntimeException e) {
            log.warn("Failed to read the last event position when measuring the gap of subscription {}", subscriptionId, e);
            return Optional.ofNullable(lastMeasurement.get()).map(SubscriptionGap::asStale);
        }

        long lastSeen = lastSeenPosition.get();
        @Nullable Long tipPosition = tip == null ? null : tip.position();
        long gap = tipPosition == null ? 0 : Math.max(0, tipPosition - lastSeen);
        SubscriptionGap measurement = new SubscriptionGap(subscriptionId, gap, lastSeen == NOTHING_SEEN ? null : lastSeen, tipPosition, clock.instant(), false);
        lastMeasurement.set(measurement);
        log.debug("Subscription {} is {} events behind the log", subscriptionId, gap);
        try {
            observer.onGapMeasured(measurement);
        } catch (RuntimeException e) {
            log.warn("Subscription observer failed when receiving the gap of subscription {}", subscriptionId, e);
        }
        return Optional.of(measurement);
    }

    /**
     * @return The last successful measurement, if any
     */
    public Optional<SubscriptionGap> lastMeasurement() {
        return Optional.ofNullable(lastMeasurement.get());
    }
}
