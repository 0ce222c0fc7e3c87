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

import org.jspecify.annotations.Nullable;
import org.tributary.subscription.api.exception.SubscriptionDroppedException;

/**
 * Receives notifications about the health of a subscription. Exceptions thrown by an observer never affect the subscription.
 */
public interface SubscriptionObserver {

    default void onDropped(String subscriptionId, DropReason reason, @Nullable Throwable error) {
    }

    default void onGapMeasured(SubscriptionGap gap) {
    }

    /**
     * The subscription was dropped and could not be resubscribed, it will not receive any more events until it's started again.
     */
    default void onFatalError(SubscriptionDroppedException exception) {
    }
}
