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
import org.tributary.cloudevents.TributaryExtensionGetter;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.PersistentSubscriptionSettings;
import org.tributary.subscription.api.StreamSelector;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * The server side cursor of an in-memory persistent subscription. Connections attached to the same group compete for its events.
 */
class PersistentSubscriptionGroup {
    private static final Logger log = LoggerFactory.getLogger(PersistentSubscriptionGroup.class);

    private final StreamSelector selector;
    private final String subscriptionId;
    private final PersistentSubscriptionSettings settings;
    private final LinkedBlockingDeque<PendingEvent> pending = new LinkedBlockingDeque<>();
    private final List<CloudEvent> acknowledged = new CopyOnWriteArrayList<>();
    private final List<CloudEvent> parked = new CopyOnWriteArrayList<>();
    private final List<CloudEvent> skipped = new CopyOnWriteArrayList<>();
    private final Set<InMemoryConnection> connections = ConcurrentHashMap.newKeySet();
    private volatile @Nullable Runnable unsubscribe;

    PersistentSubscriptionGroup(StreamSelector selector, String subscriptionId, PersistentSubscriptionSettings settings) {
        this.selector = selector;
        this.subscriptionId = subscriptionId;
        this.settings = settings;
    }

    void subscribeTo(InMemoryEventLog eventLog) {
        unsubscribe = eventLog.subscribe(settings.getStartFrom(), this::eventAppended);
    }

    private void eventAppended(CloudEvent event) {
        if (selector.matches(TributaryExtensionGetter.getStreamId(event))) {
            pending.offer(new PendingEvent(event, 0));
        }
    }

    @Nullable
    PendingEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return pending.poll(timeout, unit);
    }

    void acknowledge(PendingEvent event) {
        acknowledged.add(event.event());
    }

    /**
     * Redeliver the event, or park it when it has been redelivered the max number of times.
     */
    void retry(PendingEvent event, String reason) {
        if (event.retryCount() >= settings.getMaxRetryCount()) {
            log.info("Parking event {} in subscription {} after {} retries: {}", event.eventId(), subscriptionId, event.retryCount(), reason);
            parked.add(event.event());
        } else {
            pending.offerFirst(event.redelivered());
        }
    }

    /**
     * Hand back an event that was in flight on a connection that is gone.
     */
    void requeue(PendingEvent event) {
        pending.offerFirst(event.redelivered());
    }

    void skip(PendingEvent event, String reason) {
        log.debug("Skipping event {} in subscription {}: {}", event.eventId(), subscriptionId, reason);
        skipped.add(event.event());
    }

    void park(PendingEvent event, String reason) {
        log.info("Parking event {} in subscription {}: {}", event.eventId(), subscriptionId, reason);
        parked.add(event.event());
    }

    /**
     * Move all parked events back to the pending events, as new deliveries.
     *
     * @return The number of replayed events
     */
    int replayParked() {
        List<CloudEvent> toReplay = List.copyOf(parked);
        parked.removeAll(toReplay);
        toReplay.forEach(event -> pending.offer(new PendingEvent(event, 0)));
        return toReplay.size();
    }

    void connected(InMemoryConnection connection) {
        connections.add(connection);
    }

    void disconnected(InMemoryConnection connection) {
        connections.remove(connection);
    }

    void dropConnections(DropReason reason, @Nullable Throwable error) {
        List.copyOf(connections).forEach(connection -> connection.drop(reason, error));
    }

    void delete() {
        Runnable unsubscribeFromLog = unsubscribe;
        if (unsubscribeFromLog != null) {
            unsubscribeFromLog.run();
        }
        dropConnections(DropReason.SUBSCRIPTION_DELETED, null);
        pending.clear();
    }

    PersistentSubscriptionSettings settings() {
        return settings;
    }

    List<CloudEvent> acknowledged() {
        return List.copyOf(acknowledged);
    }

    List<CloudEvent> parked() {
        return List.copyOf(parked);
    }

    List<CloudEvent> skipped() {
        return List.copyOf(skipped);
    }

    int pendingCount() {
        return pending.size();
    }

    int inFlightCount() {
        return connections.stream().mapToInt(InMemoryConnection::inFlightCount).sum();
    }

    int connectionCount() {
        return connections.size();
    }
}
