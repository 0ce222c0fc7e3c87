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
import org.jspecify.annotations.Nullable;
import org.tributary.retry.RetryStrategy;
import org.tributary.subscription.api.CheckpointStore;
import org.tributary.subscription.api.EventProcessingFailureHandler;
import org.tributary.subscription.api.PersistentSubscriptionSettings;
import org.tributary.subscription.api.SubscriptionObserver;
import org.tributary.subscription.api.UserCredentials;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of a {@link PersistentSubscription}. Immutable, every {@code withX} method returns a new instance.
 * <p>
 * Defaults:
 * <ul>
 *     <li>{@link PersistentSubscriptionSettings} with resolved links, starting from the beginning of the log</li>
 *     <li>Events are acknowledged automatically by the transport ({@code autoAck})</li>
 *     <li>A buffer size of {@value #DEFAULT_BUFFER_SIZE} events in flight</li>
 *     <li>No credentials</li>
 *     <li>Failed events are nacked with {@link org.tributary.subscription.api.NackAction#RETRY}</li>
 *     <li>No client side checkpoints, the store keeps the position of persistent subscriptions</li>
 *     <li>No resubscribe retries, a failed resubscribe is reported as fatal</li>
 *     <li>Drops and errors are logged by {@link LoggingSubscriptionObserver}</li>
 *     <li>The gap to the tip of the log is measured every 10 seconds</li>
 * </ul>
 * </p>
 */
@NullMarked
public final class SubscriptionOptions {
    public static final int DEFAULT_BUFFER_SIZE = 10;
    public static final Duration DEFAULT_GAP_MEASURE_INTERVAL = Duration.ofSeconds(10);

    private final PersistentSubscriptionSettings settings;
    private final boolean autoAck;
    private final int bufferSize;
    private final @Nullable UserCredentials credentials;
    private final EventProcessingFailureHandler failureHandler;
    private final CheckpointStore checkpointStore;
    private final RetryStrategy resubscribeRetryStrategy;
    private final SubscriptionObserver observer;
    private final Duration gapMeasureInterval;

    public SubscriptionOptions() {
        this(new PersistentSubscriptionSettings(), true, DEFAULT_BUFFER_SIZE, null, EventProcessingFailureHandler.retry(), new NoOpCheckpointStore(),
                RetryStrategy.none(), new LoggingSubscriptionObserver(), DEFAULT_GAP_MEASURE_INTERVAL);
    }

    private SubscriptionOptions(PersistentSubscriptionSettings settings, boolean autoAck, int bufferSize, @Nullable UserCredentials credentials,
                                EventProcessingFailureHandler failureHandler, CheckpointStore checkpointStore, RetryStrategy resubscribeRetryStrategy,
                                SubscriptionObserver observer, Duration gapMeasureInterval) {
        requireNonNull(settings, PersistentSubscriptionSettings.class.getSimpleName() + " cannot be null");
        requireNonNull(failureHandler, EventProcessingFailureHandler.class.getSimpleName() + " cannot be null");
        requireNonNull(checkpointStore, CheckpointStore.class.getSimpleName() + " cannot be null");
        requireNonNull(resubscribeRetryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(observer, SubscriptionObserver.class.getSimpleName() + " cannot be null");
        requireNonNull(gapMeasureInterval, "gapMeasureInterval cannot be null");
        if (bufferSize < 1) {
            throw new IllegalArgumentException("Buffer size must be greater than or equal to 1");
        } else if (gapMeasureInterval.isNegative() || gapMeasureInterval.isZero()) {
            throw new IllegalArgumentException("Gap measure interval must be positive");
        }
        this.settings = settings;
        this.autoAck = autoAck;
        this.bufferSize = bufferSize;
        this.credentials = credentials;
        this.failureHandler = failureHandler;
        this.checkpointStore = checkpointStore;
        this.resubscribeRetryStrategy = resubscribeRetryStrategy;
        this.observer = observer;
        this.gapMeasureInterval = gapMeasureInterval;
    }

    public SubscriptionOptions withSettings(PersistentSubscriptionSettings settings) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withAutoAck(boolean autoAck) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withBufferSize(int bufferSize) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withCredentials(@Nullable UserCredentials credentials) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withFailureHandler(EventProcessingFailureHandler failureHandler) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withCheckpointStore(CheckpointStore checkpointStore) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    /**
     * @param resubscribeRetryStrategy How to retry resubscribing after the connection was dropped. Retrying stops when the subscription is stopped.
     */
    public SubscriptionOptions withResubscribeRetryStrategy(RetryStrategy resubscribeRetryStrategy) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withObserver(SubscriptionObserver observer) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public SubscriptionOptions withGapMeasureInterval(Duration gapMeasureInterval) {
        return new SubscriptionOptions(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    public PersistentSubscriptionSettings settings() {
        return settings;
    }

    public boolean autoAck() {
        return autoAck;
    }

    public int bufferSize() {
        return bufferSize;
    }

    public @Nullable UserCredentials credentials() {
        return credentials;
    }

    public EventProcessingFailureHandler failureHandler() {
        return failureHandler;
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }

    public RetryStrategy resubscribeRetryStrategy() {
        return resubscribeRetryStrategy;
    }

    public SubscriptionObserver observer() {
        return observer;
    }

    public Duration gapMeasureInterval() {
        return gapMeasureInterval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionOptions that)) return false;
        return autoAck == that.autoAck && bufferSize == that.bufferSize && Objects.equals(settings, that.settings) && Objects.equals(credentials, that.credentials)
                && Objects.equals(failureHandler, that.failureHandler) && Objects.equals(checkpointStore, that.checkpointStore)
                && Objects.equals(resubscribeRetryStrategy, that.resubscribeRetryStrategy) && Objects.equals(observer, that.observer)
                && Objects.equals(gapMeasureInterval, that.gapMeasureInterval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(settings, autoAck, bufferSize, credentials, failureHandler, checkpointStore, resubscribeRetryStrategy, observer, gapMeasureInterval);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", SubscriptionOptions.class.getSimpleName() + "[", "]")
                .add("settings=" + settings)
                .add("autoAck=" + autoAck)
                .add("bufferSize=" + bufferSize)
                .add("credentials=" + credentials)
                .add("resubscribeRetryStrategy=" + resubscribeRetryStrategy)
                .add("gapMeasureInterval=" + gapMeasureInterval)
                .toString();
    }
}
