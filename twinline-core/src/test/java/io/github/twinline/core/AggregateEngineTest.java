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

import io.github.twinline.core.TestPayloads.Added;
import io.github.twinline.core.TestPayloads.Multiplied;
import io.github.twinline.core.TestPayloads.Reset;
import io.github.twinline.core.matching.UnhandledEventException;
import io.github.twinline.core.store.inmemory.InMemoryEventLog;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.twinline.core.TestPayloads.COUNTER;
import static io.github.twinline.core.TestPayloads.COUNTER_AGGREGATE;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class AggregateEngineTest {
    private final AggregateEngine engine = new AggregateEngine();

    private static Event<Object> event(long seq, String tag, Object payload) {
        return new Event<>(tag, payload, seq, Instant.EPOCH.plusSeconds(seq));
    }

    private static List<Event<Object>> history() {
        return Arrays.asList(
                event(1, COUNTER, new Added(2)),
                event(2, "unrelated", new Added(100)),
                event(3, COUNTER, new Multiplied(3)),
                event(4, COUNTER, new Added(1)));
    }

    @Test
    public void initial_snapshot_holds_initial_state() {
        AggregateSnapshot<Integer> snapshot = engine.initial(COUNTER_AGGREGATE);

        assertEquals(Integer.valueOf(0), snapshot.getValue());
        assertEquals(0, snapshot.getAsOfSequence());
        assertEquals("counter@1", snapshot.getKey());
    }

    @Test
    public void empty_history_materializes_to_initial_state() {
        assertEquals(engine.initial(COUNTER_AGGREGATE),
                engine.materialize(COUNTER_AGGREGATE, Collections.<Event<?>>emptyList()));
    }

    @Test
    public void materialize_folds_accepted_events() {
        AggregateSnapshot<Integer> snapshot = engine.materialize(COUNTER_AGGREGATE, history());

        assertEquals(Integer.valueOf(7), snapshot.getValue());
        assertEquals(4, snapshot.getAsOfSequence());
    }

    @Test
    public void materialize_is_deterministic() {
        assertEquals(engine.materialize(COUNTER_AGGREGATE, history()),
                engine.materialize(COUNTER_AGGREGATE, history()));
    }

    @Test
    public void order_of_events_matters() {
        AggregateSnapshot<Integer> addFirst = engine.materialize(COUNTER_AGGREGATE, Arrays.asList(
                event(1, COUNTER, new Added(1)), event(2, COUNTER, new Multiplied(3))));
        AggregateSnapshot<Integer> multiplyFirst = engine.materialize(COUNTER_AGGREGATE, Arrays.asList(
                event(1, COUNTER, new Multiplied(3)), event(2, COUNTER, new Added(1))));

        assertNotEquals(addFirst.getValue(), multiplyFirst.getValue());
    }

    @Test
    public void incremental_application_matches_replay() {
        AggregateSnapshot<Integer> snapshot = engine.initial(COUNTER_AGGREGATE);
        for (Event<Object> event : history()) {
            snapshot = engine.apply(COUNTER_AGGREGATE, snapshot, event);
        }

        assertEquals(engine.materialize(COUNTER_AGGREGATE, history()), snapshot);
    }

    @Test
    public void materialize_from_log_matches_replay() throws Exception {
        try (InMemoryEventLog log = new InMemoryEventLog()) {
            log.append(COUNTER, new Added(2));
            log.append("unrelated", new Added(100));
            log.append(COUNTER, new Multiplied(3));
            log.append(COUNTER, new Added(1));

            assertEquals(engine.materialize(COUNTER_AGGREGATE, history()),
                    engine.materialize(COUNTER_AGGREGATE, log.readEvents(COUNTER_AGGREGATE.getTagFilter(), 0)));
        }
    }

    @Test
    public void rejected_or_already_applied_events_keep_snapshot() {
        AggregateSnapshot<Integer> snapshot = engine.materialize(COUNTER_AGGREGATE, history());

        assertSame(snapshot, engine.apply(COUNTER_AGGREGATE, snapshot, event(5, "unrelated", new Added(1))));
        assertSame(snapshot, engine.apply(COUNTER_AGGREGATE, snapshot, event(4, COUNTER, new Added(1))));
        assertSame(snapshot, engine.apply(COUNTER_AGGREGATE, snapshot, event(2, COUNTER, new Added(1))));
    }

    @Test
    public void unhandled_event_corrupts_aggregate() {
        try {
            engine.materialize(COUNTER_AGGREGATE, Arrays.asList(
                    event(1, COUNTER, new Added(1)), event(2, COUNTER, new Reset())));
            fail("Materialization should fail");
        } catch (AggregateCorruptedException e) {
            assertEquals("counter@1", e.getAggregateKey());
            assertEquals(2, e.getSequenceNo());
            assertThat(e.getCause(), instanceOf(UnhandledEventException.class));
        }
    }

    @Test
    public void payload_of_wrong_type_corrupts_aggregate() {
        AggregateDefinition<Integer, Added> additions = AggregateDefinition.of("additions", 0,
                TagFilter.tag(COUNTER), Added.class, 0, (state, e) -> state + e.getPayload().getAmount());

        try {
            engine.apply(additions, engine.initial(additions), event(1, COUNTER, new Multiplied(2)));
            fail("Fold should fail");
        } catch (AggregateCorruptedException e) {
            assertEquals("additions@0", e.getAggregateKey());
            assertThat(e.getCause(), instanceOf(ClassCastException.class));
        }
    }

    @Test(expected = AggregateCorruptedException.class)
    public void fold_returning_null_corrupts_aggregate() {
        AggregateDefinition<Integer, Object> broken = AggregateDefinition.of("broken", 0,
                TagFilter.all(), Object.class, 0, (state, e) -> null);

        engine.apply(broken, engine.initial(broken), event(1, COUNTER, new Added(1)));
    }

    @Test
    public void events_out_of_order_corrupt_aggregate() {
        try {
            engine.materialize(COUNTER_AGGREGATE, Arrays.asList(
                    event(2, COUNTER, new Added(1)), event(1, COUNTER, new Added(1))));
            fail("Materialization should fail");
        } catch (AggregateCorruptedException e) {
            assertEquals(1, e.getSequenceNo());
        }
    }

    @Test
    public void versions_of_same_aggregate_have_distinct_keys() {
        AggregateDefinition<Integer, Object> next = AggregateDefinition.of("counter", 2,
                COUNTER_AGGREGATE.getTagFilter(), Object.class, 0, COUNTER_AGGREGATE.getFold());

        assertNotEquals(COUNTER_AGGREGATE.getKey(), next.getKey());
    }

    @Test(expected = IllegalArgumentException.class)
    public void aggregate_id_cannot_contain_version_separator() {
        AggregateDefinition.of("counter@2", 0, TagFilter.all(), Object.class, 0, (state, e) -> state);
    }
}
