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
import jakarta.annotation.PreDestroy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.EventHandler;
import org.tributary.subscription.api.LiveConnection;
import org.tributary.subscription.api.LogTipReader;
import org.tributary.subscription.api.PersistentSubscriptionListener;
import org.tributary.subscription.api.PersistentSubscriptionTransport;
import org.tributary.subscription.api.StreamSelector;
import org.tributary.subscription.api.SubscriptionGap;
import org.tributary.subscription.api.SubscriptionHandle;
import org.tributary.subscription.api.exception.AttachException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.tributary.subscription.SubscriptionState.ATTACHED;
import static org.tributary.subscription.SubscriptionState.ATTACHING;
import static org.tributary.subscription.SubscriptionState.FAILED;
import static org.tributary.subscription.SubscriptionState.REATTACHING;
import static org.tributary.subscription.SubscriptionState.STOPPED;
import static org.tributary.subscription.internal.ExecutorShutdown.daemonThreads;
import static org.tributary.subscription.internal.ExecutorShutdown.shutdownSafely;

/**
 * A durable persistent subscription. Attaches to a named cursor kept by the store, creating it if needed, and delivers every event
 * to a {@link HandlerPipeline}. Events are acked when handled and nacked when a handler fails, so they're delivered at least once.
 * When the store drops the connection the subscription resubscribes according to {@link SubscriptionOptions#resubscribeRetryStrategy()}.
 * <p>
 * Example:
 * <pre>
 * PersistentSubscription subscription = new PersistentSubscription("order-projection", StreamSelector.stream("orders-1"), transport, log, List.of(handler));
 * subscription.start();
 * </pre>
 * </p>
 * A subscription can be started again after it has been stopped or has failed. Call {@link #shutdown()} to release its threads.
 */
@NullMarked
public class PersistentSubscription {
    private static final Logger log = LoggerFactory.getLogger(PersistentSubscription.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String subscriptionId;
    private final StreamSelector selector;
    private final SubscriptionOptions options;
    private final SubscriptionLifecycleManager lifecycleManager;
    private final SubscriptionGapMeasure gapMeasure;
    private final EventDeliveryLoop deliveryLoop;
    private final DropRecoveryStateMachine recovery;
    private final ExecutorService recoveryExecutor;
    private final ScheduledExecutorService gapMeasureScheduler;
    private final DropRecoveryStateMachine.Resubscriber resubscriber;

    // Guarded by this
    private @Nullable SubscriptionHandle handle;
    private @Nullable ScheduledFuture<?> gapMeasuring;

    private volatile boolean shutdown = false;

    /**
     * Create a subscription with the default {@link SubscriptionOptions}.
     */
    public PersistentSubscription(String subscriptionId, StreamSelector selector, PersistentSubscriptionTransport transport, LogTipReader logTipReader,
                                  List<EventHandler> handlers) {
        this(subscriptionId, selector, transport, logTipReader, new HandlerPipeline(subscriptionId, handlers), new SubscriptionOptions());
    }

    /**
     * @param subscriptionId The id of the subscription, i.e. the name of the cursor in the store
     * @param selector       The stream, or the whole log, to subscribe to
     * @param transport      The store transport
     * @param logTipReader   Reads the tip of the log when measuring the gap
     * @param pipeline       The handlers that each event is delivered to
     * @param options        The options
     */
    public PersistentSubscription(String subscriptionId, StreamSelector selector, PersistentSubscriptionTransport transport, LogTipReader logTipReader,
                                  HandlerPipeline pipeline, SubscriptionOptions options) {
        requireNonNull(subscriptionId, "subscriptionId cannot be null");
        requireNonNull(selector, StreamSelector.class.getSimpleName() + " cannot be null");
        requireNonNull(transport, PersistentSubscriptionTransport.class.getSimpleName() + " cannot be null");
        requireNonNull(logTipReader, LogTipReader.class.getSimpleName() + " cannot be null");
        requireNonNull(pipeline, HandlerPipeline.class.getSimpleName() + " cannot be null");
        requireNonNull(options, SubscriptionOptions.class.getSimpleName() + " cannot be null");
        if (subscriptionId.isBlank()) {
            throw new IllegalArgumentException("subscriptionId cannot be blank");
        }
        this.subscriptionId = subscriptionId;
        this.selector = selector;
        this.options = options;
        this.lifecycleManager = new SubscriptionLifecycleManager(subscriptionId, selector, transport, options);
        this.gapMeasure = new SubscriptionGapMeasure(subscriptionId, logTipReader, options.observer());
        this.deliveryLoop = new EventDeliveryLoop(subscriptionId, pipeline, gapMeasure, options);
        this.recoveryExecutor = Executors.newSingleThreadExecutor(daemonThreads("tributary-recovery-" + subscriptionId));
        this.gapMeasureScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("tributary-gap-" + subscriptionId));
        this.recovery = new DropRecoveryStateMachine(subscriptionId, options.observer(), options.resubscribeRetryStrategy(), recoveryExecutor, gapMeasure::lastSeenPosition);
        this.resubscriber = new DropRecoveryStateMachine.Resubscriber() {
            @Override
            public void resubscribe(boolean recreate) {
                reattach(recreate);
            }

            @Override
            public void failed() {
                resubscribeFailed();
            }
        };
    }

    /**
     * Attach to the subscription and start delivering events. Creates the subscription in the store if it doesn't exist.
     *
     * @throws AttachException       If the subscription couldn't be attached
     * @throws IllegalStateException If the subscription is already started or has been shutdown
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("Cannot start subscription " + subscriptionId + " since it's shutdown");
        }
        SubscriptionState state = recovery.state();
        if (state != STOPPED && state != FAILED) {
            throw new IllegalStateException("Subscription " + subscriptionId + " is already started (" + state + ")");
        }

        recovery.transitionTo(ATTACHING);
        try {
            handle = lifecycleManager.attach(this::newListener);
        } catch (AttachException e) {
            recovery.transitionTo(FAILED);
            log.error("Failed to start subscription {} on {}", subscriptionId, selector.name(), e);
            throw e;
        }
        recovery.transitionTo(ATTACHED);
        startMeasuringGap();
        log.info("Started subscription {} on {}", subscriptionId, selector.name());
    }

    /**
     * Stop the subscription. Events in flight are neither acked nor nacked, the store will redeliver them. Stopping an already
     * stopped subscription does nothing.
     */
    public void stop() {
        final SubscriptionHandle handleToStop;
        synchronized (this) {
            if (recovery.state() == STOPPED) {
                return;
            }
            recovery.transitionTo(STOPPED);
            handleToStop = handle;
            handle = null;
            stopMeasuringGap();
        }
        if (handleToStop != null) {
            handleToStop.stop();
        }
        log.info("Stopped subscription {}", subscriptionId);
    }

    /**
     * Stop the subscription and release its threads. The subscription cannot be started again.
     */
    @PreDestroy
    public void shutdown() {
        shutdown = true;
        stop();
        shutdownSafely(recoveryExecutor, SHUTDOWN_TIMEOUT);
        shutdownSafely(gapMeasureScheduler, SHUTDOWN_TIMEOUT);
    }

    public String subscriptionId() {
        return subscriptionId;
    }

    public SubscriptionState state() {
        return recovery.state();
    }

    public boolean isRunning() {
        return recovery.state() == ATTACHED;
    }

    /**
     * @return The handle of the current attachment, empty if the subscription isn't attached
     */
    public synchronized Optional<SubscriptionHandle> handle() {
        return Optional.ofNullable(handle);
    }

    /**
     * @return The highest global position delivered to this subscription
     */
    public OptionalLong lastSeenPosition() {
        return gapMeasure.lastSeenPosition();
    }

    /**
     * Measure the gap to the tip of the log now.
     *
     * @see SubscriptionGapMeasure#measure()
     */
    public Optional<SubscriptionGap> measureGap() {
        return gapMeasure.measure();
    }

    /**
     * @return The last gap measured, periodically or by {@link #measureGap()}
     */
    public Optional<SubscriptionGap> lastMeasuredGap() {
        return gapMeasure.lastMeasurement();
    }

    private PersistentSubscriptionListener newListener(CancellationSignal signal) {
        return new PersistentSubscriptionListener() {
            @Override
            public void onEvent(LiveConnection connection, CloudEvent event, int retryCount) {
                deliveryLoop.deliver(connection, event, retryCount, signal);
            }

            @Override
            public void onDropped(LiveConnection connection, DropReason reason, @Nullable Throwable error) {
                handleDrop(signal, reason, error);
            }
        };
    }

    private void handleDrop(CancellationSignal signal, DropReason reason, @Nullable Throwable error) {
        // Checking the attachment and moving to DROPPED happen under the same monitor as start() and stop()
        synchronized (this) {
            if (handle == null || handle.signal() != signal) {
                log.debug("Ignoring drop ({}) of a previous connection of subscription {}", reason, subscriptionId);
                return;
            }
            SubscriptionHandle dropped = handle;
            handle = null;
            dropped.stop();
            if (reason.isClientInitiated()) {
                stopMeasuringGap();
            }
            recovery.onDropped(reason, error, resubscriber);
        }
    }

    private synchronized void reattach(boolean recreate) {
        if (recovery.state() != REATTACHING) {
            throw new CancellationException("Subscription " + subscriptionId + " is no longer resubscribing");
        }
        if (handle != null) {
            SubscriptionHandle previous = handle;
            handle = null;
            previous.stop();
        }
        handle = recreate ? lifecycleManager.recreate(this::newListener) : lifecycleManager.attach(this::newListener);
        recovery.transitionTo(ATTACHED);
    }

    private synchronized void resubscribeFailed() {
        if (recovery.state() == FAILED) {
            stopMeasuringGap();
        }
    }

    // Guarded by this
    private void startMeasuringGap() {
        stopMeasuringGap();
        long interval = options.gapMeasureInterval().toMillis();
        gapMeasuring = gapMeasureScheduler.scheduleAtFixedRate(gapMeasure::measure, interval, interval, MILLISECONDS);
    }

    // Guarded by this
    private void stopMeasuringGap() {
        if (gapMeasuring != null) {
            gapMeasuring.cancel(false);
            gapMeasuring = null;
        }
    }
}
