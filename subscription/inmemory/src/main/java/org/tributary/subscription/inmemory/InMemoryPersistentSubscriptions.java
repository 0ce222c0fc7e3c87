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
import jakarta.annotation.PreDestroy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.LiveConnection;
import org.tributary.subscription.api.PersistentSubscriptionListener;
import org.tributary.subscription.api.PersistentSubscriptionSettings;
import org.tributary.subscription.api.PersistentSubscriptionTransport;
import org.tributary.subscription.api.StreamSelector;
import org.tributary.subscription.api.UserCredentials;
import org.tributary.subscription.api.exception.SubscriptionAlreadyExistsException;
import org.tributary.subscription.api.exception.SubscriptionNotFoundException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.util.Objects.requireNonNull;
import static org.tributary.subscription.internal.ExecutorShutdown.daemonThreads;
import static org.tributary.subscription.internal.ExecutorShutdown.shutdownSafely;

/**
 * An in-memory {@link PersistentSubscriptionTransport} on top of an {@link InMemoryEventLog}. Keeps named cursors with
 * at-least-once delivery, retries, parked events and competing connections, and lets tests drop connections or delete
 * subscriptions to simulate server side failures.
 * <p>
 * Credentials and {@link PersistentSubscriptionSettings#isResolveLinkTos()} are accepted but not used since the log has no
 * access control and no link events.
 * </p>
 */
@NullMarked
public class InMemoryPersistentSubscriptions implements PersistentSubscriptionTransport {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistentSubscriptions.class);

    private final InMemoryEventLog eventLog;
    private final ConcurrentMap<String, PersistentSubscriptionGroup> groups = new ConcurrentHashMap<>();
    private final ExecutorService dropNotifier;

    private volatile boolean shutdown = false;

    public InMemoryPersistentSubscriptions(InMemoryEventLog eventLog) {
        this.eventLog = requireNonNull(eventLog, InMemoryEventLog.class.getSimpleName() + " cannot be null");
        this.dropNotifier = Executors.newCachedThreadPool(daemonThreads("tributary-inmemory-drop"));
    }

    @Override
    public synchronized void create(StreamSelector selector, String subscriptionId, PersistentSubscriptionSettings settings, @Nullable UserCredentials credentials) {
        requireNonNull(selector, StreamSelector.class.getSimpleName() + " cannot be null");
        requireNonNull(subscriptionId, "subscriptionId cannot be null");
        requireNonNull(settings, PersistentSubscriptionSettings.class.getSimpleName() + " cannot be null");
        assertNotShutdown();
        String key = key(selector, subscriptionId);
        if (groups.containsKey(key)) {
            throw new SubscriptionAlreadyExistsException(subscriptionId, selector.name());
        }
        PersistentSubscriptionGroup group = new PersistentSubscriptionGroup(selector, subscriptionId, settings);
        group.subscribeTo(eventLog);
        groups.put(key, group);
        log.info("Created persistent subscription {} on {}", subscriptionId, selector.name());
    }

    @Override
    public LiveConnection attach(StreamSelector selector, String subscriptionId, PersistentSubscriptionListener listener, @Nullable UserCredentials credentials,
                                 int bufferSize, boolean autoAck) {
        requireNonNull(selector, StreamSelector.class.getSimpleName() + " cannot be null");
        requireNonNull(subscriptionId, "subscriptionId cannot be null");
        requireNonNull(listener, PersistentSubscriptionListener.class.getSimpleName() + " cannot be null");
        if (bufferSize < 1) {
            throw new IllegalArgumentException("Buffer size must be greater than or equal to 1");
        }
        assertNotShutdown();
        PersistentSubscriptionGroup group = findGroup(selector, subscriptionId);
        InMemoryConnection connection = new InMemoryConnection(subscriptionId, group, listener, bufferSize, autoAck, dropNotifier);
        group.connected(connection);
        connection.start();
        return connection;
    }

    /**
     * Delete a subscription. Its connections are dropped with {@link DropReason#SUBSCRIPTION_DELETED}.
     */
    public synchronized void deleteSubscription(StreamSelector selector, String subscriptionId) {
        PersistentSubscriptionGroup group = groups.remove(key(selector, subscriptionId));
        if (group == null) {
            throw new SubscriptionNotFoundException(subscriptionId, selector.name());
        }
        group.delete();
        log.info("Deleted persistent subscription {} on {}", subscriptionId, selector.name());
    }

    /**
     * Drop all connections of a subscription, as if the server dropped them.
     */
    public void dropConnections(StreamSelector selector, String subscriptionId, DropReason reason, @Nullable Throwable error) {
        requireNonNull(reason, DropReason.class.getSimpleName() + " cannot be null");
        findGroup(selector, subscriptionId).dropConnections(reason, error);
    }

    public boolean exists(StreamSelector selector, String subscriptionId) {
        return groups.containsKey(key(selector, subscriptionId));
    }

    public List<CloudEvent> acknowledgedEvents(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).acknowledged();
    }

    public List<CloudEvent> parkedEvents(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).parked();
    }

    public List<CloudEvent> skippedEvents(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).skipped();
    }

    /**
     * Deliver the parked events of a subscription again.
     *
     * @return The number of events that were replayed
     */
    public int replayParkedEvents(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).replayParked();
    }

    /**
     * @return The number of events that wait to be delivered to a connection.
     */
    public int pendingCount(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).pendingCount();
    }

    /**
     * @return The number of events delivered to the connections of the subscription that are neither acked nor nacked.
     */
    public int inFlightCount(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).inFlightCount();
    }

    public int connectionCount(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).connectionCount();
    }

    public PersistentSubscriptionSettings settings(StreamSelector selector, String subscriptionId) {
        return findGroup(selector, subscriptionId).settings();
    }

    /**
     * Drop all connections with {@link DropReason#SERVER_SHUTDOWN} and refuse new subscriptions.
     */
    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            shutdown = true;
            groups.values().forEach(group -> group.dropConnections(DropReason.SERVER_SHUTDOWN, null));
        }
        shutdownSafely(dropNotifier, Duration.ofSeconds(5));
    }

    private PersistentSubscriptionGroup findGroup(StreamSelector selector, String subscriptionId) {
        PersistentSubscriptionGroup group = groups.get(key(selector, subscriptionId));
        if (group == null) {
            throw new SubscriptionNotFoundException(subscriptionId, selector.name());
        }
        return group;
    }

    private void assertNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException(InMemoryPersistentSubscriptions.class.getSimpleName() + " is shutdown");
        }
    }

    private static String key(StreamSelector selector, String subscriptionId) {
        return selector.name() + "::" + subscriptionId;
    }
}
