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

import java.util.EnumSet;
import java.util.Set;

/**
 * The states of a {@link PersistentSubscription}. Any state may move to {@link #STOPPED}.
 */
public enum SubscriptionState {
    STOPPED, ATTACHING, ATTACHED, DROPPED, REATTACHING, FAILED;

    boolean canTransitionTo(SubscriptionState next) {
        return next == STOPPED || allowedNext().contains(next);
    }

    private Set<SubscriptionState> allowedNext() {
        switch (this) {
            case STOPPED:
            case FAILED:
                return EnumSet.of(ATTACHING);
            case ATTACHING:
                return EnumSet.of(ATTACHED, FAILED);
            case ATTACHED:
                return EnumSet.of(DROPPED);
            case DROPPED:
                return EnumSet.of(REATTACHING, FAILED);
            case REATTACHING:
                return EnumSet.of(ATTACHED, FAILED);
            default:
                throw new IllegalStateException("Unknown state " + this);
        }
    }
}
