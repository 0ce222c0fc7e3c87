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
import io.cloudevents.core.builder.CloudEventBuilder;
import org.tributary.subscription.api.ReceivedEvent;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static org.tributary.cloudevents.TributaryCloudEventExtension.tributary;

class WireEvents {

    static CloudEvent wireEvent(String type, String streamId, long streamVersion, long globalPosition) {
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(URI.create("urn:tributary:test"))
                .withType(type)
                .withTime(OffsetDateTime.of(2026, 10, 18, 12, 0, 0, 0, UTC))
                .withData("{}".getBytes(UTF_8))
                .withExtension(tributary(streamId, streamVersion, globalPosition))
                .build();
    }

    static ReceivedEvent receivedEvent(String type, long globalPosition) {
        return ReceivedEvents.fromCloudEvent(wireEvent(type, "orders-1", globalPosition, globalPosition), 0);
    }
}
