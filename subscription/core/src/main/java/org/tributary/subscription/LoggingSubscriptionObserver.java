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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.DropReason;
import org.tributary.subscription.api.SubscriptionGap;
import org.tributary.subscription.api.SubscriptionObserver;
import org.tributary.subscription.api.exception.SubscriptionDroppedException;

/**
 * A {@link SubscriptionObserver} that writes everything it observes to the log.
 */
public class LoggingSubscriptionObserver implements SubscriptionObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingSubscriptionObserver.class);

    @Override
    public void onDropped(String subscriptionId, DropReason reason, @Nullable Throwable error) {
        log.warn("Subscription {} dropped ({})", subscriptionId, reason, error);
    }

    @Override
    public void onGapMeasured(SubscriptionGap gap) {
        log.debug("Subscription {} gap is {} (last seen {}, tip {})", gap.subscriptionId(), gap.gap(), gap.lastSeenPosition(), gap.tipPosition());
    }

    @Override
    public void onFatalError(SubscriptionDroppedException exception) {
        log.error("Subscription {} failed permanently", exception.getSubscriptionId(), exception);
    }
}
