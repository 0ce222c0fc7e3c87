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

package org.tributary.retry;

import java.time.Duration;

/**
 * Contains useful information of the state of the retry
 */
public interface RetryInfo {

    /**
     * @return The number of <i>this</i> attempt, {@code 1} if first attempt.
     */
    int getAttemptNumber();

    /**
     * @return The count of the <i>current</i> retry, {@code 0} for the first attempt and {@code 1} for the first retry.
     */
    default int getRetryCount() {
        return getAttemptNumber() - 1;
    }

    /**
     * @return The maximum number of attempts configured for the retry. Returns {@code Integer.MAX_VALUE} if infinite.
     */
    int getMaxAttempts();

    /**
     * @return The number of attempts left, including this one. Returns {@code Integer.MAX_VALUE} if infinite.
     */
    default int getAttemptsLeft() {
        if (isInfiniteRetriesLeft()) {
            return Integer.MAX_VALUE;
        }
        return getMaxAttempts() - getAttemptNumber() + 1;
    }

    /**
     * @return {@code true} if there are infinite retry attempts left, {@code false} otherwise.
     */
    boolean isInfiniteRetriesLeft();

    /**
     * @return The backoff that was applied before <i>this</i> attempt, {@link Duration#ZERO} for the first attempt.
     */
    Duration getBackoff();

    default boolean isFirstAttempt() {
        return getAttemptNumber() == 1;
    }

    default boolean isLastAttempt() {
        return !isInfiniteRetriesLeft() && getAttemptNumber() == getMaxAttempts();
    }
}
