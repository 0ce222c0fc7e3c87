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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.LiveConnection;
import org.tributary.subscription.api.SubscriptionHandle;

import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SubscriptionHandle} wrapping a {@link LiveConnection}, stopping it cancels the lifetime and closes the connection once.
 */
class LiveSubscriptionHandle implements SubscriptionHandle {
    private static final Logger log = LoggerFactory.getLogger(LiveSubscriptionHandle.class);

    private final String subscriptionId;
    private final LiveConnection connection;
    private final SubscriptionLifetime lifetime;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    LiveSubscriptionHandle(String subscriptionId, LiveConnection connection, SubscriptionLifetime lifetime) {
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
        this.connection = requireNonNull(connection, LiveConnection.class.getSimpleName() + " cannot be null");
        this.lifetime = requireNonNull(lifetime, SubscriptionLifetime.class.getSimpleName() + " cannot be null");
    }

    @Override
    public String subscriptionId() {
        return subscriptionId;
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            lifetime.cancel();
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close connection of subscription {}", subscriptionId, e);
            }
        }
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public CancellationSignal signal() {
        return lifetime;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", LiveSubscriptionHandle.class.getSimpleName() + "[", "]")
                .add("subscriptionId='" + subscriptionId + "'")
                .add("stopped=" + stopped.get())
                .toString();
    }
}
