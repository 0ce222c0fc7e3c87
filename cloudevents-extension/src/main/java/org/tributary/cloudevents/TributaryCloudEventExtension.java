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
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that carries the log coordinates of an event. These are:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #STREAM_ID}</td><td>The id of the stream the event was appended to</td></tr>
 *     <tr><td>{@value #STREAM_VERSION}</td><td>The position of the event in its stream, starting at 0</td></tr>
 *     <tr><td>{@value #GLOBAL_POSITION}</td><td>The position of the event in the whole log</td></tr>
 * </table>
 * <p>
 * Event metadata is carried separately, as the optional binary extension {@value #METADATA}.
 * </p>
 */
public class TributaryCloudEventExtension implements CloudEventExtension {
    public static final String STREAM_ID = "streamid";
    public static final String STREAM_VERSION = "streamversion";
    public static final String GLOBAL_POSITION = "globalposition";
    public static final String METADATA = "metadata";

    static final Set<String> KEYS = Set.of(STREAM_ID, STREAM_VERSION, GLOBAL_POSITION);

    private String streamId;
    private long streamVersion;
    private long globalPosition;

    public TributaryCloudEventExtension(String streamId, long streamVersion, long globalPosition) {
        Objects.requireNonNull(streamId, "StreamId cannot be null");
        if (streamVersion < 0) {
            throw new IllegalArgumentException("Stream version cannot be negative");
        } else if (globalPosition < 0) {
            throw new IllegalArgumentException("Global position cannot be negative");
        }
        this.streamId = streamId;
        this.streamVersion = streamVersion;
        this.globalPosition = globalPosition;
    }

    public static TributaryCloudEventExtension tributary(String streamId, long streamVersion, long globalPosition) {
        return new TributaryCloudEventExtension(streamId, streamVersion, globalPosition);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object streamId = extensions.getExtension(STREAM_ID);
        if (streamId != null) {
            this.streamId = streamId.toString();
        }

        Object streamVersion = extensions.getExtension(STREAM_VERSION);
        if (streamVersion instanceof Number number) {
            this.streamVersion = number.longValue();
        }

        Object globalPosition = extensions.getExtension(GLOBAL_POSITION);
        if (globalPosition instanceof Number number) {
            this.globalPosition = number.longValue();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        switch (key) {
            case STREAM_ID:
                return streamId;
            case STREAM_VERSION:
                return streamVersion;
            case GLOBAL_POSITION:
                return globalPosition;
            default:
                throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
        }
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
