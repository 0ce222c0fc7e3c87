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

package org.tributary.subscription.api.exception;

import org.jspecify.annotations.Nullable;
import org.tributary.subscription.api.DropReason;

/**
 * The connection of a subscription was dropped. Reported as fatal when the subscription could not be resubscribed.
 */
public class SubscriptionDroppedException extends SubscriptionException {
    private final DropReason reason;
    private final @Nullable Long lastKnownPosition;

    public SubscriptionDroppedException(String subscriptionId, DropReason reason, @Nullable Long lastKnownPosition, @Nullable Throwable cause) {
        super(subscriptionId, "Subscription " + subscriptionId + " was dropped (" + reason + ") at position " + lastKnownPosition + " and could not be resubscribed", cause);
        this.reason = reason;
        this.lastKnownPosition = lastKnownPosition;
    }

    public DropReason getReason() {
        return reason;
    }

    public @Nullable Long getLastKnownPosition() {
        return lastKnownPosition;
    }
}
