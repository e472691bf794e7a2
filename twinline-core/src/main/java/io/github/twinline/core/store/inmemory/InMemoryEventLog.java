package io.github.twinline.core.store.inmemory;

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
import io.github.twinline.core.store.EventLog;
import io.github.twinline.core.store.EventLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Event log kept in memory of single process. Used when all control loops run in same process, and in tests.
 *
 * <p>Subscribers are invoked synchronously by the appending thread. When a subscriber appends another event from
 * within its callback, that event is delivered only after the current one reached all subscribers, so every
 * subscriber observes the log in sequence order.</p>
 */
public class InMemoryEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLog.class);

    private final List<Event<Object>> events = new ArrayList<>();
    private final List<LiveSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Deque<Event<Object>> undelivered = new ArrayDeque<>();
    private final Clock clock;
    private boolean delivering;
    private boolean closed;

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    public InMemoryEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Hook for subclasses to refuse an append.
     * @param tag tag of appended event
     * @param payload appended payload
     * @throws EventLogException to fail the append
     */
    protected void beforeAppend(String tag, Object payload) throws EventLogException {
    }

    @Override
    public synchronized CompletableFuture<Event<Object>> append(String tag, Object payload) {
        Objects.requireNonNull(tag, "Tag must be specified");
        Objects.requireNonNull(payload, "Payload must be specified");
        try {
            if (closed) {
                throw EventLogException.closed();
            }
            beforeAppend(tag, payload);
        } catch (EventLogException e) {
            return CompletableFuture.failedFuture(e);
        }
        Event<Object> event = new Event<>(tag, payload, events.size() + 1, clock.instant());
        events.add(event);
        logger.debug("Appended {}", event);
        undelivered.add(event);
        deliver();
        return CompletableFuture.completedFuture(event);
    }

    private void deliver() {
        if (delivering) {
            // the outer invocation on the stack will pick the event up
            return;
        }
        delivering = true;
        try {
            Event<Object> event;
            while ((event = undelivered.poll()) != null) {
                for (LiveSubscription subscription : subscriptions) {
                    subscription.offer(event);
                }
            }
        } finally {
            delivering = false;
        }
    }

    @Override
    public synchronized EventSubscription subscribe(TagFilter filter, long afterSequence,
            Consumer<? super Event<Object>> consumer, Consumer<? super Throwable> onFailure) {
        LiveSubscription subscription = new LiveSubscription(filter, afterSequence, consumer);
        if (closed) {
            subscription.close();
            return subscription;
        }
        int from = (int) Math.min(Math.max(afterSequence, 0), events.size());
        // events still waiting for delivery are replayed here and skipped by the delivery loop afterwards
        for (Event<Object> event : new ArrayList<>(events.subList(from, events.size()))) {
            subscription.offer(event);
        }
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public synchronized StoredEvents readEvents(TagFilter filter, long afterSequence) {
        List<Event<Object>> filteredEvents = events.stream()
                .filter(e -> e.getSequenceNo() > afterSequence && filter.accepts(e))
                .collect(toList());
        return new StoredEvents() {
            boolean stop = false;

            @Override
            public void foreach(Consumer<? super Event<Object>> consumer) {
                for (Event<Object> event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super Event<Object>, R> reducer) {
                R result = initial;
                for (Event<Object> event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }

    @Override
    public synchronized long lastSequence() {
        return events.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        subscriptions.forEach(LiveSubscription::close);
    }

    class LiveSubscription implements EventSubscription {
        private final TagFilter filter;
        private final Consumer<? super Event<Object>> consumer;
        private long lastOffered;
        private volatile boolean closed;

        LiveSubscription(TagFilter filter, long afterSequence, Consumer<? super Event<Object>> consumer) {
            this.filter = Objects.requireNonNull(filter);
            this.consumer = Objects.requireNonNull(consumer);
            this.lastOffered = afterSequence;
        }

        void offer(Event<Object> event) {
            if (closed || event.getSequenceNo() <= lastOffered) {
                return;
            }
            lastOffered = event.getSequenceNo();
            if (filter.accepts(event)) {
                try {
                    consumer.accept(event);
                } catch (RuntimeException e) {
                    logger.error("Subscriber {} failed to accept {}", consumer, event, e);
                }
            }
        }

        @Override
        public void close() {
            closed = true;
            subscriptions.remove(this);
        }

        @Override
        public boolean isClosed() {
            return closed;
        }
    }
}
