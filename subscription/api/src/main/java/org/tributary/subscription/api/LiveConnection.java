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

import io.cloudevents.CloudEvent;

/**
 * A connection to a persistent subscription, returned by {@link PersistentSubscriptionTransport#attach}.
 * An event is settled by the first ack or nack for it, later calls for the same delivery are ignored.
 */
public interface LiveConnection extends AutoCloseable {

    void ack(CloudEvent event);

    void nack(NackAction action, String reason, CloudEvent event);

    /**
     * Close the connection. Events that are in flight are handed back to the store for redelivery and
     * the listener receives a drop notification with reason {@link DropReason#CLIENT_STOP}.
     */
    @Override
    void close();
}
