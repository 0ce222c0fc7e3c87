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

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import org.tributary.cloudevents.TributaryExtensionGetter;
import org.tributary.subscription.api.ReceivedEvent;

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * Maps wire events into {@link ReceivedEvent}s.
 */
public class ReceivedEvents {

    /**
     * @param cloudEvent A cloud event carrying the log coordinates as {@link org.tributary.cloudevents.TributaryCloudEventExtension} extensions
     * @param retryCount The number of times the store has redelivered the event
     * @throws IllegalArgumentException If the cloud event lacks the log coordinates or a creation time
     */
    public static ReceivedEvent fromCloudEvent(CloudEvent cloudEvent, int retryCount) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        OffsetDateTime created = cloudEvent.getTime();
        if (created == null) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " " + cloudEvent.getId() + " has no time");
        }
        long streamPosition = TributaryExtensionGetter.getStreamVersion(cloudEvent);
        CloudEventData data = cloudEvent.getData();
        return new ReceivedEvent(cloudEvent.getId(),
                TributaryExtensionGetter.getGlobalPosition(cloudEvent),
                TributaryExtensionGetter.getStreamId(cloudEvent),
                streamPosition,
                streamPosition,
                cloudEvent.getType(),
                created,
                data == null ? new byte[0] : data.toBytes(),
                TributaryExtensionGetter.getMetadata(cloudEvent),
                retryCount);
    }
}
