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
import io.github.twinline.core.MockEventLog;
import io.github.twinline.core.TagFilter;
import io.github.twinline.core.TestPayloads.Added;
import io.github.twinline.core.store.EventLog;
import io.github.twinline.core.store.EventLogException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static java.util.stream.Collectors.toList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryEventLogTest {
    private final InMemoryEventLog log = new InMemoryEventLog();

    private static List<Long> sequences(List<Event<Object>> events) {
        return events.stream().map(Event::getSequenceNo).collect(toList());
    }

    private static void unexpected(Throwable t) {
        throw new AssertionError("Unexpected failure", t);
    }

    private static EventLogException failureOf(CompletableFuture<?> future) throws InterruptedException {
        try {
            future.get();
            throw new AssertionError("Future should fail");
        } catch (ExecutionException e) {
            return (EventLogException) e.getCause();
        }
    }

    @Test
    public void appends_are_numbered_from_one() {
        assertEquals(1, log.append("a", new Added(1)).join().getSequenceNo());
        assertEquals(2, log.append("b", new Added(2)).join().getSequenceNo());
        assertEquals(2, log.lastSequence());
    }

    @Test
    public void subscriber_gets_history_then_live_events() {
        log.append("a", new Added(1));
        log.append("b", new Added(2));
        List<Event<Object>> received = new ArrayList<>();

        log.subscribe(TagFilter.tag("a"), 0, received::add, InMemoryEventLogTest::unexpected);
        log.append("a", new Added(3));
        log.append("b", new Added(4));

        assertEquals(Arrays.asList(1L, 3L), sequences(received));
    }

    @Test
    public void subscriber_starts_after_given_sequence() {
        log.append("a", new Added(1));
        log.append("a", new Added(2));
        List<Event<Object>> received = new ArrayList<>();

        log.subscribe(TagFilter.all(), 1, received::add, InMemoryEventLogTest::unexpected);

        assertEquals(Arrays.asList(2L), sequences(received));
    }

    @Test
    public void appends_from_subscriber_are_delivered_in_order() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        log.subscribe(TagFilter.all(), 0, e -> {
            first.add(e.getTag() + e.getSequenceNo());
            if (e.getTag().equals("trigger")) {
                log.append("reaction", new Added(0));
            }
        }, InMemoryEventLogTest::unexpected);
        log.subscribe(TagFilter.all(), 0, e -> second.add(e.getTag() + e.getSequenceNo()),
                InMemoryEventLogTest::unexpected);

        log.append("trigger", new Added(1));

        assertEquals(Arrays.asList("trigger1", "reaction2"), first);
        assertEquals(first, second);
    }

    @Test
    public void failing_subscriber_does_not_affect_others() {
        List<Event<Object>> received = new ArrayList<>();
        log.subscribe(TagFilter.all(), 0, e -> {
            throw new IllegalStateException("Subscriber failure");
        }, InMemoryEventLogTest::unexpected);
        log.subscribe(TagFilter.all(), 0, received::add, InMemoryEventLogTest::unexpected);

        log.append("a", new Added(1));

        assertEquals(1, received.size());
    }

    @Test
    public void closed_subscription_gets_no_events() {
        List<Event<Object>> received = new ArrayList<>();
        EventLog.EventSubscription subscription = log.subscribe(TagFilter.all(), 0, received::add,
                InMemoryEventLogTest::unexpected);

        subscription.close();
        log.append("a", new Added(1));

        assertTrue(subscription.isClosed());
        assertTrue(received.isEmpty());
    }

    @Test
    public void read_events_can_stop() {
        for (int i = 1; i <= 5; i++) {
            log.append("a", new Added(i));
        }
        List<Event<Object>> read = new ArrayList<>();
        try (EventLog.StoredEvents events = log.readEvents(TagFilter.tag("a"), 1)) {
            events.foreach(e -> {
                read.add(e);
                if (read.size() == 2) {
                    events.stop();
                }
            });
        }
        assertEquals(Arrays.asList(2L, 3L), sequences(read));
    }

    @Test
    public void closed_log_rejects_appends() throws InterruptedException {
        log.close();

        assertEquals(EventLogException.Fault.CLOSED, failureOf(log.append("a", new Added(1))).getFault());
    }

    @Test
    public void refused_append_is_not_stored() throws InterruptedException {
        MockEventLog mock = new MockEventLog();
        mock.failNextAppends(1, EventLogException.unavailable("a", null));

        EventLogException failure = failureOf(mock.append("a", new Added(1)));
        Event<Object> next = mock.append("a", new Added(2)).join();

        assertTrue(failure.isTransient());
        assertEquals(1, next.getSequenceNo());
        assertEquals(2, mock.getAttempts());
    }

    @Test
    public void null_payload_is_refused() {
        try {
            log.append("a", null);
            fail("Null payload should be refused");
        } catch (NullPointerException e) {
            assertEquals(0, log.lastSequence());
        }
    }
}
