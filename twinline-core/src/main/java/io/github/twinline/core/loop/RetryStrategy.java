package io.github.twinline.core.loop;

/*-
 * #%L
 * twinline-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.twinline.core.store.EventLogException;

import java.util.concurrent.TimeUnit;

/**
 * Strategy for retrying an append that failed.
 * Returns delay in milliseconds before next attempt. Returning {@code 0} means to retry immediately, returning
 * less than {@code 0} means not to retry.
 */
@FunctionalInterface
public interface RetryStrategy {
    long DO_NOT_RETRY = -1;
    long RETRY_NOW = 0;

    /**
     * @param emission the emission that failed
     * @param t the failure
     * @param completedAttempts number of attempts made so far, at least {@code 1}
     * @return negative for giving up, zero for immediate retry, positive for delay in ms until next attempt
     */
    long retryDelay(Emission emission, Throwable t, int completedAttempts);

    RetryStrategy NO_RETRIES = (emission, t, attempts) -> DO_NOT_RETRY;

    /**
     * Retry strategy that never retries.
     * @return a retry strategy
     */
    static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Three attempts, 500 milliseconds apart.
     * @return a retry strategy
     */
    static RetryStrategy defaultStrategy() {
        return fixedRetries(3, 500, TimeUnit.MILLISECONDS);
    }

    /**
     * Create retry strategy that allows fix number of attempts with defined retry delay. Only transient failures
     * of the log are retried, a rejected or unserializable payload would fail the same way again.
     * @param attempts number of attempt to allow
     * @param delay delay before retrying the append
     * @param unit unit of delay
     * @return a retry strategy
     */
    static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedRepeat(attempts, unit.toMillis(delay));
    }

    class FixedRepeat implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedRepeat(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(Emission emission, Throwable t, int completedAttempts) {
            if (t instanceof EventLogException && !((EventLogException) t).isTransient()) {
                return DO_NOT_RETRY;
            }
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
