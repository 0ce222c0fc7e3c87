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

package org.tributary.cloudevents;

import io.cloudevents.CloudEvent;

import java.nio.charset.StandardCharsets;

import static org.tributary.cloudevents.TributaryCloudEventExtension.GLOBAL_POSITION;
import static org.tributary.cloudevents.TributaryCloudEventExtension.METADATA;
import static org.tributary.cloudevents.TributaryCloudEventExtension.STREAM_ID;
import static org.tributary.cloudevents.TributaryCloudEventExtension.STREAM_VERSION;

/**
 * Utility class that reads the {@link TributaryCloudEventExtension} values, converted to the correct type, from a {@link CloudEvent}.
 */
public class TributaryExtensionGetter {

    public static String getStreamId(CloudEvent cloudEvent) {
        Object streamId = requireExtension(cloudEvent, STREAM_ID);
        if (!(streamId instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + STREAM_ID + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) streamId;
    }

    public static long getStreamVersion(CloudEvent cloudEvent) {
        return getLong(cloudEvent, STREAM_VERSION);
    }

    public static long getGlobalPosition(CloudEvent cloudEvent) {
        return getLong(cloudEvent, GLOBAL_POSITION);
    }

    /**
     * @return The bytes of the {@value TributaryCloudEventExtension#METADATA} extension, or an empty array if the cloud event has no metadata.
     */
    public static byte[] getMetadata(CloudEvent cloudEvent) {
        Object metadata = cloudEvent.getExtension(METADATA);
        if (metadata == null) {
            return new byte[0];
        } else if (metadata instanceof byte[] bytes) {
            return bytes.clone();
        } else if (metadata instanceof String string) {
            return string.getBytes(StandardCharsets.UTF_8);
        }
        throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " contains a " + METADATA + " value of unsupported type " + metadata.getClass().getSimpleName());
    }

    private static long getLong(CloudEvent cloudEvent, String key) {
        Object value = requireExtension(cloudEvent, key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + key + " value that is an instance of " + long.class.getSimpleName());
        }
        return ((Number) value).longValue();
    }

    private static Object requireExtension(CloudEvent cloudEvent, String key) {
        Object value = cloudEvent.getExtension(key);
        if (value == null) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + key + " key");
        }
        return value;
    }
}
