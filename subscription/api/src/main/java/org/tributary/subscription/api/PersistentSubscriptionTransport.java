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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.subscription.api.exception.SubscriptionAlreadyExistsException;
import org.tributary.subscription.api.exception.SubscriptionNotFoundException;

/**
 * The client side of a store that manages persistent subscriptions, i.e. named cursors that are kept by the store.
 * Implementations deliver events and drop notifications on their own threads.
 */
@NullMarked
public interface PersistentSubscriptionTransport {

    /**
     * Attach to an existing persistent subscription.
     *
     * @param selector       The stream, or the whole log, that the subscription reads
     * @param subscriptionId The id (group name) of the subscription
     * @param listener       Receives events and drop notifications for the returned connection
     * @param credentials    Optional credentials
     * @param bufferSize     The max number of events that may be in flight (unacknowledged) for this connection
     * @param autoAck        If {@code true}, the transport acknowledges an event once the listener returns, unless it was already acked or nacked
     * @return The live connection
     * @throws SubscriptionNotFoundException If the subscription doesn't exist
     */
    LiveConnection attach(StreamSelector selector, String subscriptionId, PersistentSubscriptionListener listener, @Nullable UserCredentials credentials,
                          int bufferSize, boolean autoAck);

    /**
     * Create the server side cursor of a persistent subscription.
     *
     * @throws SubscriptionAlreadyExistsException If a subscription with the same id already exists for the selector
     */
    void create(StreamSelector selector, String subscriptionId, PersistentSubscriptionSettings settings, @Nullable UserCredentials credentials);
}
