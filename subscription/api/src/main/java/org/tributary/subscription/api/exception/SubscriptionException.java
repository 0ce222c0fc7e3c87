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

import static java.util.Objects.requireNonNull;

/**
 * Base class of all errors that concern a specific subscription.
 */
public class SubscriptionException extends RuntimeException {
    private final String subscriptionId;

    public SubscriptionException(String subscriptionId, String message) {
        super(message);
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
    }

    public SubscriptionException(String subscriptionId, String message, Throwable cause) {
        super(message, cause);
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }
}
