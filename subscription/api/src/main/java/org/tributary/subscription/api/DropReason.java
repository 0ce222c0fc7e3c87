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

/**
 * The reason a persistent subscription connection was dropped.
 */
public enum DropReason {
    SERVER_SHUTDOWN,
    CONSUMER_TOO_SLOW,
    SUBSCRIPTION_DELETED,
    NETWORK_ERROR,
    /**
     * The client closed the connection itself
     */
    CLIENT_STOP;

    public boolean isClientInitiated() {
        return this == CLIENT_STOP;
    }
}
