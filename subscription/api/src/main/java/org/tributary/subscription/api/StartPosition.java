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
 * Where a newly created persistent subscription starts in the log.
 */
public sealed interface StartPosition {

    static StartPosition start() {
        return Start.INSTANCE;
    }

    static StartPosition end() {
        return End.INSTANCE;
    }

    static StartPosition at(long position) {
        return new At(position);
    }

    record Start() implements StartPosition {
        private static final Start INSTANCE = new Start();
    }

    record End() implements StartPosition {
        private static final End INSTANCE = new End();
    }

    record At(long position) implements StartPosition {
        public At {
            if (position < 0) {
                throw new IllegalArgumentException("position cannot be negative");
            }
        }
    }
}
