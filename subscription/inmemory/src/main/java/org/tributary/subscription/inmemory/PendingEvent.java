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

package org.tributary.subscription.inmemory;

import io.cloudevents.CloudEvent;

/**
 * An event waiting to be delivered by a persistent subscription, together with the number of times it has been redelivered.
 */
record PendingEvent(CloudEvent event, int retryCount) {

    PendingEvent redelivered() {
        return new PendingEvent(event, retryCount + 1);
    }

    String eventId() {
        return event.getId();
    }
}
