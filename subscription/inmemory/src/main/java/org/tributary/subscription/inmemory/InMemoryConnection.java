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

package org.tributary.subscription.inmemory;

import io.cloudevents.CloudEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.LiveConnection;
import org.tributary.subscription.api.NackAction;
import org.tributary.subscription.api.PersistentSubscriptionListener;

import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.tributary.subscription.internal.ExecutorShutdown.daemonThreads;

/**
 * A connection to an in-memory persistent subscription. Events are pulled from the {@link PersistentSubscriptionGroup} by
 * {@code bufferSize} workers, and at most {@code bufferSize} events are in flight (delivered but not yet acked or nacked).
 */
class InMemoryConnection implements LiveConnection {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConnection.class);
    private static final long POLL_INTERVAL_MILLIS = 500;

    private final String subscriptionId;
    private final PersistentSubscriptionGroup group;
    private final PersistentSubscriptionListener listener;
    private final boolean autoAck;
    private final int bufferSize;
    private final Executor dropNotifier;
    private final Semaphore inFlightPermits;
    private final ConcurrentMap<String, PendingEvent> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService workers;

    InMemoryConnection(String subscriptionId, PersistentSubscriptionGroup group, PersistentSubscriptionListener listener, int bufferSize, boolean autoAck,
                       Executor dropNotifier) {
        this.subscriptionId = subscriptionId;
        this.group = group;
        this.listener = listener;
        this.autoAck = autoAck;
        this.bufferSize = bufferSize;
        this.dropNotifier = dropNotifier;
        this.inFlightPermits = new Semaphore(bufferSize);
        this.workers = Executors.newFixedThreadPool(bufferSize, daemonThreads("tributary-inmemory-" + subscriptionId));
    }

    void start() {
        for (int i = 0; i < bufferSize; i++) {
            workers.execute(this::deliverUntilClosed);
        }
    }

    private void deliverUntilClosed() {
        while (!closed.get()) {
            try {
                if (!inFlightPermits.tryAcquire(POLL_INTERVAL_MILLIS, MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            final PendingEvent pendingEvent;
            try {
                pendingEvent = group.poll(POLL_INTERVAL_MILLIS, MILLISECONDS);
            } catch (InterruptedException e) {
                inFlightPermits.release();
                Thread.currentThread().interrupt();
                return;
            }

            if (pendingEvent == null) {
                inFlightPermits.release();
            } else if (closed.get()) {
                inFlightPermits.release();
                group.requeue(pendingEvent);
            } else {
                deliver(pendingEvent);
            }
        }
    }

    private void deliver(PendingEvent pendingEvent) {
        inFlight.put(pendingEvent.eventId(), pendingEvent);
        if (closed.get()) {
            if (inFlight.remove(pendingEvent.eventId(), pendingEvent)) {
                inFlightPermits.release();
                group.requeue(pendingEvent);
            }
            return;
        }
        try {
            listener.onEvent(this, pendingEvent.event(), pendingEvent.retryCount());
        } catch (Throwable e) {
            log.warn("Listener of subscription {} threw when receiving event {}", subscriptionId, pendingEvent.eventId(), e);
        }
        if (autoAck) {
            ack(pendingEvent.event());
        }
    }

    @Override
    public void ack(CloudEvent event) {
        requireNonNull(event, CloudEvent.class.getSimpleName() + " cannot be null");
        PendingEvent pendingEvent = settle(event);
        if (pendingEvent != null) {
            group.acknowledge(pendingEvent);
        }
    }

    @Override
    public void nack(NackAction action, String reason, CloudEvent event) {
        requireNonNull(action, NackAction.class.getSimpleName() + " cannot be null");
        requireNonNull(event, CloudEvent.class.getSimpleName() + " cannot be null");
        PendingEvent pendingEvent = settle(event);
        if (pendingEvent == null) {
            return;
        }
        switch (action) {
            case RETRY -> group.retry(pendingEvent, reason);
            case SKIP -> group.skip(pendingEvent, reason);
            case PARK -> group.park(pendingEvent, reason);
        }
    }

    private @Nullable PendingEvent settle(CloudEvent event) {
        PendingEvent pendingEvent = inFlight.remove(event.getId());
        if (pendingEvent != null) {
            inFlightPermits.release();
        }
        return pendingEvent;
    }

    @Override
    public void close() {
        if (disconnect()) {
            log.debug("Connection to subscription {} closed by the client", subscriptionId);
            listener.onDropped(this, DropReason.CLIENT_STOP, null);
        }
    }

    /**
     * Drop the connection from the server side. The listener is notified on the drop notifier.
     */
    void drop(DropReason reason, @Nullable Throwable error) {
        if (disconnect()) {
            log.debug("Dropping connection to subscription {} ({})", subscriptionId, reason);
            dropNotifier.execute(() -> listener.onDropped(this, reason, error));
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private boolean disconnect() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        group.disconnected(this);
        workers.shutdown();
        for (PendingEvent pendingEvent : inFlight.values()) {
            if (inFlight.remove(pendingEvent.eventId(), pendingEvent)) {
                inFlightPermits.release();
                group.requeue(pendingEvent);
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", InMemoryConnection.class.getSimpleName() + "[", "]")
                .add("subscriptionId='" + subscriptionId + "'")
                .add("bufferSize=" + bufferSize)
                .add("autoAck=" + autoAck)
                .add("closed=" + closed.get())
                .toString();
    }
}
