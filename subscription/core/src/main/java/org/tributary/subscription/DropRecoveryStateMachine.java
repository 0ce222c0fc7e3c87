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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.retry.RetryStrategy;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.SubscriptionObserver;
import org.tributary.subscription.api.exception.SubscriptionDroppedException;

import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.tributary.retry.internal.RetryExecution.executeWithRetry;
import static org.tributary.subscription.SubscriptionState.ATTACHED;
import static org.tributary.subscription.SubscriptionState.DROPPED;
import static org.tributary.subscription.SubscriptionState.FAILED;
import static org.tributary.subscription.SubscriptionState.REATTACHING;
import static org.tributary.subscription.SubscriptionState.STOPPED;

/**
 * Keeps the {@link SubscriptionState} of a subscription and decides what to do when its connection is dropped.
 * <p>
 * A drop initiated by the client ({@link DropReason#CLIENT_STOP}) is terminal and silent. Every other drop is reported to the
 * {@link SubscriptionObserver} and followed by a resubscribe on the recovery executor, retried according to the configured
 * {@link RetryStrategy}. If resubscribing fails the subscription moves to {@link SubscriptionState#FAILED} and the failure is
 * reported once.
 * </p>
 */
@NullMarked
public class DropRecoveryStateMachine {
    private static final Logger log = LoggerFactory.getLogger(DropRecoveryStateMachine.class);

    /**
     * Attaches the subscription again. Must move the state machine to {@link SubscriptionState#ATTACHED} on success.
     */
    @FunctionalInterface
    public interface Resubscriber {
        /**
         * @param recreate {@code true} if the server side cursor must be created before attaching
         */
        void resubscribe(boolean recreate);

        /**
         * Invoked on the recovery executor when resubscribing has failed for good and the subscription is {@link SubscriptionState#FAILED},
         * before the failure is reported to the {@link SubscriptionObserver}.
         */
        default void failed() {
        }
    }

    private final String subscriptionId;
    private final SubscriptionObserver observer;
    private final RetryStrategy retryStrategy;
    private final Executor recoveryExecutor;
    private final Supplier<OptionalLong> lastKnownPosition;

    private SubscriptionState state = STOPPED;

    public DropRecoveryStateMachine(String subscriptionId, SubscriptionObserver observer, RetryStrategy retryStrategy, Executor recoveryExecutor,
                                    Supplier<OptionalLong> lastKnownPosition) {
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
        this.observer = requireNonNull(observer, SubscriptionObserver.class.getSimpleName() + " cannot be null");
        this.retryStrategy = requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        this.recoveryExecutor = requireNonNull(recoveryExecutor, "recoveryExecutor cannot be null");
        this.lastKnownPosition = requireNonNull(lastKnownPosition, "lastKnownPosition cannot be null");
    }

    public synchronized SubscriptionState state() {
        return state;
    }

    /**
     * @throws IllegalStateException If the transition isn't allowed from the current state
     */
    public synchronized void transitionTo(SubscriptionState next) {
        requireNonNull(next, SubscriptionState.class.getSimpleName() + " cannot be null");
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Subscription " + subscriptionId + " cannot move from " + state + " to " + next);
        }
        log.debug("Subscription {} moved from {} to {}", subscriptionId, state, next);
        state = next;
    }

    private synchronized boolean transitionIf(SubscriptionState expected, SubscriptionState next) {
        if (state != expected) {
            return false;
        }
        transitionTo(next);
        return true;
    }

    /**
     * Handle that the current connection was dropped.
     *
     * @param reason      Why the connection was dropped
     * @param error       The error reported by the transport, if any
     * @param resubscriber Invoked on the recovery executor to attach again
     */
    public void onDropped(DropReason reason, @Nullable Throwable error, Resubscriber resubscriber) {
        requireNonNull(reason, DropReason.class.getSimpleName() + " cannot be null");
        requireNonNull(resubscriber, Resubscriber.class.getSimpleName() + " cannot be null");

        if (reason.isClientInitiated()) {
            synchronized (this) {
                if (state != STOPPED) {
                    transitionTo(STOPPED);
                }
            }
            log.debug("Subscription {} was stopped by the client", subscriptionId);
            return;
        }

        if (!transitionIf(ATTACHED, DROPPED)) {
            log.debug("Ignoring drop ({}) of subscription {} in state {}", reason, subscriptionId, state());
            return;
        }

        log.warn("Subscription {} was dropped ({}), resubscribing", subscriptionId, reason, error);
        try {
            observer.onDropped(subscriptionId, reason, error);
        } catch (RuntimeException e) {
            log.warn("Subscription observer failed when notified about the drop of subscription {}", subscriptionId, e);
        }

        try {
            recoveryExecutor.execute(() -> resubscribe(reason, error, resubscriber));
        } catch (RejectedExecutionException e) {
            log.debug("Recovery of subscription {} was rejected, it's shutting down", subscriptionId);
            transitionIf(DROPPED, STOPPED);
        }
    }

    private void resubscribe(DropReason reason, @Nullable Throwable dropError, Resubscriber resubscriber) {
        if (!transitionIf(DROPPED, REATTACHING)) {
            return;
        }

        boolean recreate = reason == DropReason.SUBSCRIPTION_DELETED;
        try {
            executeWithRetry(() -> {
                resubscriber.resubscribe(recreate);
                return null;
            }, __ -> state() == REATTACHING, retryStrategy).get();
            log.info("Resubscribed subscription {} after it was dropped ({})", subscriptionId, reason);
        } catch (RuntimeException e) {
            if (!transitionIf(REATTACHING, FAILED)) {
                log.debug("Subscription {} was stopped while resubscribing", subscriptionId);
                return;
            }
            try {
                resubscriber.failed();
            } catch (RuntimeException failedError) {
                log.warn("Failed to release subscription {} after resubscribing failed", subscriptionId, failedError);
            }
            reportFatal(reason, dropError, e);
        }
    }

    private void reportFatal(DropReason reason, @Nullable Throwable dropError, RuntimeException resubscribeError) {
        OptionalLong position = lastKnownPosition.get();
        SubscriptionDroppedException fatal = new SubscriptionDroppedException(subscriptionId, reason, position.isPresent() ? position.getAsLong() : null, resubscribeError);
        if (dropError != null) {
            fatal.addSuppressed(dropError);
        }
        log.error("Subscription {} couldn't be resubscribed after it was dropped ({}) at position {}", subscriptionId, reason, fatal.getLastKnownPosition(), fatal);
        try {
            observer.onFatalError(fatal);
        } catch (RuntimeException e) {
            log.warn("Subscription observer failed when notified about the fatal error of subscription {}", subscriptionId, e);
        }
    }
}
