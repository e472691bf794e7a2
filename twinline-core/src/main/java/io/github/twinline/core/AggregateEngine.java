package io.github.twinline.core;

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

import io.github.twinline.core.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes aggregate state by folding events of the log.
 *
 * <p>Two modes are supported. {@code materialize} replays history from the initial state, {@code apply} folds
 * one more event onto an existing snapshot. Both produce the same state for the same sequence of events.</p>
 */
public class AggregateEngine {
    private static final Logger logger = LoggerFactory.getLogger(AggregateEngine.class);

    public <S> AggregateSnapshot<S> initial(AggregateDefinition<S, ?> definition) {
        return new AggregateSnapshot<>(definition.getId(), definition.getVersion(), definition.getInitialState(), 0);
    }

    /**
     * Replay events in given order. Events not accepted by the definition are skipped.
     * @param definition the aggregate
     * @param events events in increasing sequence order
     * @param <S> type of state
     * @return snapshot after last accepted event
     * @throws AggregateCorruptedException when fold fails, or events are not ordered
     */
    public <S> AggregateSnapshot<S> materialize(AggregateDefinition<S, ?> definition,
            Iterable<? extends Event<?>> events) {
        Replay<S> replay = new Replay<>(definition, initial(definition));
        for (Event<?> event : events) {
            replay.accept(event);
        }
        return replay.finish();
    }

    /**
     * Replay events read from the log.
     * @param definition the aggregate
     * @param events stored events, as returned by {@link EventLog#readEvents}
     * @param <S> type of state
     * @return snapshot after last accepted event
     * @throws AggregateCorruptedException when fold fails, or events are not ordered
     */
    public <S> AggregateSnapshot<S> materialize(AggregateDefinition<S, ?> definition,
            EventLog.StoredEvents events) {
        Replay<S> replay = new Replay<>(definition, initial(definition));
        events.foreach(replay::accept);
        return replay.finish();
    }

    /**
     * Fold single event onto a snapshot.
     * @param definition the aggregate
     * @param snapshot current snapshot of the aggregate
     * @param event next event of the log
     * @param <S> type of state
     * @return new snapshot, or the same instance when the event is not accepted or was already applied
     * @throws AggregateCorruptedException when fold fails
     */
    public <S> AggregateSnapshot<S> apply(AggregateDefinition<S, ?> definition, AggregateSnapshot<S> snapshot,
            Event<?> event) {
        if (!definition.accepts(event) || event.getSequenceNo() <= snapshot.getAsOfSequence()) {
            return snapshot;
        }
        return fold(definition, snapshot, event);
    }

    private static <S, E> AggregateSnapshot<S> fold(AggregateDefinition<S, E> definition,
            AggregateSnapshot<S> snapshot, Event<?> event) {
        S next;
        try {
            next = definition.getFold().apply(snapshot.getValue(), event.as(definition.getEventType()));
        } catch (RuntimeException e) {
            throw new AggregateCorruptedException(definition.getKey(), event.getSequenceNo(), e);
        }
        if (next == null) {
            throw new AggregateCorruptedException(definition.getKey(), event.getSequenceNo(),
                    "fold returned no state", null);
        }
        return new AggregateSnapshot<>(definition.getId(), definition.getVersion(), next, event.getSequenceNo());
    }

    private static class Replay<S> {
        private final AggregateDefinition<S, ?> definition;
        private final long start = System.currentTimeMillis();
        private final AtomicInteger applied = new AtomicInteger();
        private AggregateSnapshot<S> snapshot;
        private long lastSequence;

        Replay(AggregateDefinition<S, ?> definition, AggregateSnapshot<S> initial) {
            this.definition = definition;
            this.snapshot = initial;
        }

        void accept(Event<?> event) {
            if (event.getSequenceNo() <= lastSequence) {
                throw new AggregateCorruptedException(definition.getKey(), event.getSequenceNo(),
                        "event follows event " + lastSequence, null);
            }
            lastSequence = event.getSequenceNo();
            if (definition.accepts(event)) {
                snapshot = fold(definition, snapshot, event);
                applied.incrementAndGet();
            }
        }

        AggregateSnapshot<S> finish() {
            logger.debug("Aggregate {} materialized in {} ms replaying {} events", definition.getKey(),
                    System.currentTimeMillis() - start, applied.get());
            return snapshot;
        }
    }
}
