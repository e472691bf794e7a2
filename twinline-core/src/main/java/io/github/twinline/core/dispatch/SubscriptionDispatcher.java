package io.github.twinline.core.dispatch;

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

import io.github.twinline.core.AggregateCorruptedException;
import io.github.twinline.core.AggregateDefinition;
import io.github.twinline.core.AggregateEngine;
import io.github.twinline.core.AggregateSnapshot;
import io.github.twinline.core.Event;
import io.github.twinline.core.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes state of aggregates to their observers.
 *
 * <p>Each aggregate key has at most one feed. The first observer of a key materializes the aggregate from history
 * and subscribes to the log for events that follow. Further observers get the current snapshot of the feed and
 * then every new one. Every accepted event is folded once, and the snapshot is delivered to all listeners of the
 * feed.</p>
 *
 * <p>All work, including delivery to the listeners, happens on the {@link LoopScheduler}. Feeds of different
 * aggregates are independent, so two events emitted together are observed as two separate updates.</p>
 *
 * <p>When an event cannot be folded, the feed halts, all its listeners are notified of the
 * {@link AggregateCorruptedException}, and the key cannot be observed anymore in this dispatcher.</p>
 */
public class SubscriptionDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionDispatcher.class);

    private final EventLog log;
    private final LoopScheduler scheduler;
    private final AggregateEngine engine;
    // accessed only from scheduler
    private final Map<String, Feed<?>> feeds = new HashMap<>();
    private final Map<String, AggregateCorruptedException> corrupted = new ConcurrentHashMap<>();

    public SubscriptionDispatcher(EventLog log, LoopScheduler scheduler) {
        this(log, scheduler, new AggregateEngine());
    }

    public SubscriptionDispatcher(EventLog log, LoopScheduler scheduler, AggregateEngine engine) {
        this.log = Objects.requireNonNull(log);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.engine = Objects.requireNonNull(engine);
    }

    public LoopScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Register listener of an aggregate. The listener first receives current snapshot of the aggregate, and then a
     * new snapshot for every event the aggregate accepts.
     *
     * @param definition the aggregate
     * @param listener the listener
     * @param <S> type of state
     * @return the subscription
     * @throws IllegalStateException when the aggregate is known to be corrupted
     */
    public <S> Subscription observe(AggregateDefinition<S, ?> definition, SnapshotListener<S> listener) {
        Objects.requireNonNull(definition, "Definition must be specified");
        Objects.requireNonNull(listener, "Listener must be specified");
        failIfCorrupted(definition.getKey());
        ListenerSubscription<S> subscription = new ListenerSubscription<>(definition.getKey(), listener);
        scheduler.execute(() -> register(definition, subscription));
        return subscription;
    }

    /**
     * Check whether an aggregate was halted due to corruption.
     * @param aggregateKey key of the aggregate
     * @return true if the aggregate is corrupted
     */
    public boolean isCorrupted(String aggregateKey) {
        return corrupted.containsKey(aggregateKey);
    }

    private void failIfCorrupted(String key) {
        AggregateCorruptedException corruption = corrupted.get(key);
        if (corruption != null) {
            throw new IllegalStateException("Aggregate " + key + " is corrupted", corruption);
        }
    }

    private <S> void register(AggregateDefinition<S, ?> definition, ListenerSubscription<S> subscription) {
        if (subscription.isClosed()) {
            return;
        }
        String key = definition.getKey();
        AggregateCorruptedException corruption = corrupted.get(key);
        if (corruption != null) {
            subscription.fail(corruption);
            return;
        }
        Feed<S> feed = (Feed<S>) feeds.get(key);
        if (feed == null) {
            feed = new Feed<>(definition);
            feeds.put(key, feed);
            feed.add(subscription);
            feed.start();
        } else {
            feed.add(subscription);
        }
    }

    /**
     * Stop all feeds. Listeners are not notified.
     */
    @Override
    public void close() {
        scheduler.execute(() -> new ArrayList<>(feeds.values()).forEach(Feed::stop));
    }

    class Feed<S> {
        private final AggregateDefinition<S, ?> definition;
        private final List<ListenerSubscription<S>> listeners = new ArrayList<>();
        private AggregateSnapshot<S> snapshot;
        private EventLog.EventSubscription logSubscription;
        private boolean halted;

        Feed(AggregateDefinition<S, ?> definition) {
            this.definition = definition;
        }

        void start() {
            try (EventLog.StoredEvents events = log.readEvents(definition.getTagFilter(), 0)) {
                snapshot = engine.materialize(definition, events);
            } catch (RuntimeException e) {
                halt(e);
                return;
            }
            logger.debug("Aggregate {} starts at {}", definition.getKey(), snapshot);
            logSubscription = log.subscribe(definition.getTagFilter(), snapshot.getAsOfSequence(),
                    event -> scheduler.execute(() -> onEvent(event)),
                    failure -> scheduler.execute(() -> halt(failure)));
            AggregateSnapshot<S> initial = snapshot;
            new ArrayList<>(listeners).forEach(l -> l.deliver(initial));
        }

        void add(ListenerSubscription<S> subscription) {
            subscription.feed = this;
            listeners.add(subscription);
            if (snapshot != null) {
                subscription.deliver(snapshot);
            }
        }

        void remove(ListenerSubscription<S> subscription) {
            if (listeners.remove(subscription) && listeners.isEmpty()) {
                logger.debug("Last listener of aggregate {} left", definition.getKey());
                stop();
            }
        }

        void onEvent(Event<Object> event) {
            if (halted) {
                return;
            }
            AggregateSnapshot<S> next;
            try {
                next = engine.apply(definition, snapshot, event);
            } catch (AggregateCorruptedException e) {
                halt(e);
                return;
            }
            if (next == snapshot) {
                return;
            }
            AggregateSnapshot<S> current = next;
            snapshot = current;
            logger.debug("Aggregate {} updated by {}", definition.getKey(), event);
            new ArrayList<>(listeners).forEach(l -> l.deliver(current));
        }

        void halt(Throwable failure) {
            if (halted) {
                return;
            }
            stop();
            if (failure instanceof AggregateCorruptedException) {
                corrupted.put(definition.getKey(), (AggregateCorruptedException) failure);
                logger.error("Aggregate {} is corrupted, its updates are halted", definition.getKey(), failure);
            } else {
                logger.error("Aggregate {} lost its event feed", definition.getKey(), failure);
            }
            List<ListenerSubscription<S>> failed = new ArrayList<>(listeners);
            listeners.clear();
            failed.forEach(l -> l.fail(failure));
        }

        void stop() {
            halted = true;
            feeds.remove(definition.getKey(), this);
            if (logSubscription != null) {
                logSubscription.close();
            }
        }
    }

    class ListenerSubscription<S> implements Subscription {
        private final String aggregateKey;
        private final SnapshotListener<S> listener;
        private Feed<S> feed;
        private volatile boolean closed;

        ListenerSubscription(String aggregateKey, SnapshotListener<S> listener) {
            this.aggregateKey = aggregateKey;
            this.listener = listener;
        }

        void deliver(AggregateSnapshot<S> snapshot) {
            if (closed) {
                return;
            }
            try {
                listener.onSnapshot(snapshot);
            } catch (RuntimeException e) {
                logger.error("Listener {} of aggregate {} failed to accept {}", listener, aggregateKey, snapshot, e);
            }
        }

        void fail(Throwable failure) {
            if (closed) {
                return;
            }
            closed = true;
            try {
                listener.onFailure(failure);
            } catch (RuntimeException e) {
                logger.error("Listener {} of aggregate {} failed to handle failure", listener, aggregateKey, e);
            }
        }

        @Override
        public String getAggregateKey() {
            return aggregateKey;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            scheduler.execute(() -> {
                if (feed != null) {
                    feed.remove(this);
                }
            });
        }

        @Override
        public boolean isClosed() {
            return closed;
        }
    }
}
