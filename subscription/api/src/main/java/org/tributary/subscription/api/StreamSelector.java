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

import static java.util.Objects.requireNonNull;

/**
 * Selects the events that a persistent subscription receives, either the events of a single stream or the whole log.
 */
public sealed interface StreamSelector {
    String ALL_STREAM_NAME = "$all";

    static StreamSelector stream(String streamId) {
        return new Stream(streamId);
    }

    static StreamSelector all() {
        return All.INSTANCE;
    }

    /**
     * @return The name of the selected stream, or {@value #ALL_STREAM_NAME} for the whole log.
     */
    String name();

    boolean matches(String streamId);

    record Stream(String streamId) implements StreamSelector {
        public Stream {
            requireNonNull(streamId, "streamId cannot be null");
            if (streamId.isBlank()) {
                throw new IllegalArgumentException("streamId cannot be blank");
            }
        }

        @Override
        public String name() {
            return streamId;
        }

        @Override
        public boolean matches(String streamId) {
            return this.streamId.equals(streamId);
        }
    }

    record All() implements StreamSelector {
        private static final All INSTANCE = new All();

        @Override
        public String name() {
            return ALL_STREAM_NAME;
        }

        @Override
        public boolean matches(String streamId) {
            return true;
        }
    }
}
