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

/**
 * Represents one live attachment to a persistent subscription.
 */
@NullMarked
public interface SubscriptionHandle {

    /**
     * @return The id of the subscription
     */
    String subscriptionId();

    /**
     * Stop the attachment and dispose the underlying connection. Calling stop more than once, also from different threads,
     * disposes the connection exactly once.
     */
    void stop();

    boolean isStopped();

    /**
     * @return The signal that is cancelled when this handle is stopped
     */
    CancellationSignal signal();
}
