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

package org.tributary.retry.internal;

import org.tributary.retry.MaxAttempts;
import org.tributary.retry.RetryInfo;

import java.time.Duration;

record RetryInfoImpl(int attemptNumber, MaxAttempts maxAttempts, Duration backoff) implements RetryInfo {

    @Override
    public int getAttemptNumber() {
        return attemptNumber;
    }

    @Override
    public int getMaxAttempts() {
        if (maxAttempts instanceof MaxAttempts.Limit limit) {
            return limit.limit();
        }
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isInfiniteRetriesLeft() {
        return maxAttempts instanceof MaxAttempts.Infinite;
    }

    @Override
    public Duration getBackoff() {
        return backoff;
    }
}
