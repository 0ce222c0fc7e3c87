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
import org.tributary.retry.RetryStrategy;
import org.tributary.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    /**
     * @param supplier          The action to execute
     * @param continuePredicate Retries stop as soon as this predicate returns {@code false}, typically used to abort retrying when
     *                          the owning component is shutting down.
     * @param retryStrategy     The strategy to apply
     */
    public static <T> Supplier<T> executeWithRetry(Supplier<T> supplier, Predicate<Throwable> continuePredicate, RetryStrategy retryStrategy) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        Function<RetryInfo, T> fn = executeWithRetry(__ -> supplier.get(), continuePredicate, retryStrategy);
        return () -> fn.apply(null);
    }

    public static <T> Function<RetryInfo, T> executeWithRetry(Function<RetryInfo, T> function, Predicate<Throwable> continuePredicate, RetryStrategy retryStrategy) {
        Objects.requireNonNull(function, Function.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(continuePredicate, "Continue predicate cannot be null");
        Objects.requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        if (retryStrategy instanceof DontRetry) {
            return __ -> function.apply(new RetryInfoImpl(1, new MaxAttempts.Limit(1), Duration.ZERO));
        } else if (!(retryStrategy instanceof RetryImpl retry)) {
            throw new IllegalArgumentException("Unsupported retry strategy: " + retryStrategy.getClass().getName());
        } else {
            return __ -> executeWithRetry(function, continuePredicate, retry);
        }
    }

    private static <T> T executeWithRetry(Function<RetryInfo, T> function, Predicate<Throwable> continuePredicate, RetryImpl retry) {
        int attemptNumber = 1;
        Duration backoffBeforeThisAttempt = Duration.ZERO;
        for (; ; ) {
            RetryInfoImpl retryInfo = new RetryInfoImpl(attemptNumber, retry.maxAttempts, backoffBeforeThisAttempt);
            try {
                return function.apply(retryInfo);
            } catch (Throwable e) {
                retry.errorListener.accept(retryInfo, e);
                boolean shouldRetry = !retry.maxAttempts.isExhaustedBy(attemptNumber) && continuePredicate.test(e) && retry.retryPredicate.test(e);
                if (!shouldRetry) {
                    return SafeExceptionRethrower.safeRethrow(e);
                }

                Duration backoff = retry.backoff.delayAfter(attemptNumber);
                sleep(backoff, e);

                attemptNumber++;
                backoffBeforeThisAttempt = backoff;
                retry.onBeforeRetryListener.accept(new RetryInfoImpl(attemptNumber, retry.maxAttempts, backoff), e);
            }
        }
    }

    private static void sleep(Duration backoff, Throwable cause) {
        long millis = backoff.toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            SafeExceptionRethrower.safeRethrow(cause);
        }
    }
}
