package io.github.twinline.core.store;

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

import io.github.twinline.core.Event;
import io.github.twinline.core.TagFilter;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Durable, append-only, tag addressable sequence of immutable events.
 *
 * <p>The log assigns every appended event a sequence number that is strictly greater than of any event appended
 * before it. Readers and subscribers always receive events in sequence order. No ordering is implied between
 * appends of independent writers, and two appends are never atomic together.</p>
 */
public interface EventLog extends AutoCloseable {

    /**
     * Append single event.
     * @param tag the tag the event is addressed with
     * @param payload the payload, must be serializable by the log implementation
     * @return future completing with the stored event, that carries assigned sequence number. Completes
     *         exceptionally with {@link EventLogException} when the event was not stored.
     */
    CompletableFuture<Event<Object>> append(String tag, Object payload);

    /**
     * Push events accepted by the filter to the consumer. Stored events past {@code afterSequence} are delivered
     * first, followed by events appended later, all in sequence order. Subscribing again with sequence number of
     * last seen event restarts the stream without gaps or duplicates.
     *
     * @param filter selects the events
     * @param afterSequence deliver events with sequence greater than this. 0 stands for entire history
     * @param consumer receiver of the events
     * @param onFailure receives the failure that ended the subscription, e. g. an event that could not be read
     * @return handle to end the subscription
     */
    EventSubscription subscribe(TagFilter filter, long afterSequence, Consumer<? super Event<Object>> consumer,
            Consumer<? super Throwable> onFailure);

    /**
     * Read stored events accepted by the filter.
     * @param filter selects the events
     * @param afterSequence events that were appended after this sequence number. 0 returns entire history
     * @return accessor for the events in order they appeared in history
     */
    StoredEvents readEvents(TagFilter filter, long afterSequence);

    /**
     * Sequence number of the most recently stored event.
     * @return last sequence number, 0 for empty log
     */
    long lastSequence();

    /**
     * Release resources of the log. Live subscriptions stop, further appends fail with
     * {@link EventLogException.Fault#CLOSED}.
     */
    @Override
    void close();

    /**
     * Live subscription to the log.
     */
    interface EventSubscription extends AutoCloseable {
        /**
         * Stop delivery. Events being delivered concurrently may still arrive.
         */
        @Override
        void close();

        boolean isClosed();
    }

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a JDBC
     * ResultSet. This also means that only one of methods foreach and reduce may be called on single instance, and
     * only once.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super Event<Object>> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super Event<Object>, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
