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

import org.tributary.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.tributary.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, every configuration method returns a new instance:
 * <pre>
 * RetryStrategy resubscribe = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0).maxAttempts(10);
 * resubscribe.execute(() -&gt; subscription.attach());
 * </pre>
 * </p>
 */
public interface RetryStrategy {

    /**
     * Create a retry strategy that performs retries if exceptions are caught. By default there's no backoff,
     * infinite attempts and all exceptions are retried.
     *
     * @return {@link Retry}
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * Create a retry strategy that doesn't perform retries (i.e. retries are disabled).
     *
     * @return {@link DontRetry}
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier))}.
     *
     * @param initial    The initial wait time before retrying the first time
     * @param max        Max wait time
     * @param multiplier Multiplier between retries
     * @return A retry strategy with exponential backoff
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(duration))}.
     *
     * @param duration The duration to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(millis))}.
     *
     * @param millis The number of millis to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(long millis) {
        return RetryStrategy.retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute a {@link Function} that receives the current {@link RetryInfo}.
     * Rethrows the last exception if the retry strategy is exhausted.
     *
     * @param function A function that takes {@link RetryInfo} and returns the result
     * @return The result of the function, if successful.
     */
    default <T> T execute(Function<RetryInfo, T> function) {
        Objects.requireNonNull(function, Function.class.getSimpleName() + " cannot be null");
        return executeWithRetry(function, __ -> true, this).apply(null);
    }

    /**
     * Execute a {@link Supplier} with the configured retry settings.
     * Rethrows the last exception if the retry strategy is exhausted.
     *
     * @param supplier The supplier to execute
     * @return The result of the supplier, if successful.
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(__ -> supplier.get(), __ -> true, this).apply(null);
    }

    /**
     * Execute a {@link Runnable} with the configured retry settings.
     * Rethrows the last exception if the retry strategy is exhausted.
     *
     * @param runnable The runnable to execute
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(__ -> {
            runnable.run();
            return null;
        }, __ -> true, this).apply(null);
    }

    /**
     * A retry strategy that doesn't retry at all. Just rethrows the exception.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * Configure the backoff settings for the retry strategy.
         *
         * @param backoff The backoff to use.
         * @return A new instance of {@link Retry} with the backoff settings applied.
         * @see Backoff
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         *
         * @return A new instance of {@link Retry} with infinite number of retry attempts.
         * @see #maxAttempts(int)
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of attempts the action should be invoked before failing.
         *
         * @return A new instance of {@link Retry} with the max number of attempts configured.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the specified predicate is {@code true}. Will override previous retry predicate.
         *
         * @return A new instance of {@link Retry} with the given retry predicate
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Add an error listener that will be invoked for every error that happens during the execution,
         * including the one that exhausts the strategy.
         *
         * @param errorListener The consumer to invoke
         * @return A new instance of {@link Retry} with the given error listener
         */
        Retry onError(BiConsumer<RetryInfo, Throwable> errorListener);

        /**
         * @see #onError(BiConsumer)
         */
        default Retry onError(Consumer<Throwable> errorListener) {
            Objects.requireNonNull(errorListener, "Error listener cannot be null");
            return onError((__, throwable) -> errorListener.accept(throwable));
        }

        /**
         * Specify a listener that will be invoked <i>before</i> each retry takes place, with the retry info of
         * the coming attempt and the exception that caused the retry.
         *
         * @param onBeforeRetryListener The bi-consumer to invoke
         * @return A new instance of {@link Retry} with the given listener
         */
        Retry onBeforeRetry(BiConsumer<RetryInfo, Throwable> onBeforeRetryListener);
    }
}
