package io.github.twinline.factory;

/*-
 * #%L
 * twinline-factory
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

import io.github.twinline.core.dispatch.SubscriptionDispatcher;
import io.github.twinline.core.dispatch.VirtualTimeScheduler;
import io.github.twinline.core.store.inmemory.InMemoryEventLog;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.Produced;
import io.github.twinline.factory.event.Tossed;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DashboardTest {
    private final List<String> displayed = new ArrayList<>();
    private final List<Throwable> failures = new ArrayList<>();
    private InMemoryEventLog log;
    private VirtualTimeScheduler scheduler;
    private Dashboard dashboard;

    @Before
    public void setUp() {
        log = new InMemoryEventLog();
        scheduler = new VirtualTimeScheduler();
        dashboard = new Dashboard(new SubscriptionDispatcher(log, scheduler), displayed::add);
        dashboard.setFailureHandler(failures::add);
    }

    @After
    public void tearDown() {
        dashboard.close();
        log.close();
    }

    @Test
    public void dashboard_shows_current_state_of_every_twin() {
        log.append(FactoryTags.MACHINE, Produced.of(2));

        dashboard.start();
        scheduler.runPending();

        assertEquals(4, displayed.size());
        assertThat(displayed.get(0), startsWith("{\"aggregate\":\"machine@0\",\"asOf\":1,\"state\":{"));
        assertThat(displayed.get(0), containsString("\"bufferQty\":2"));
        assertThat(displayed.get(1), startsWith("{\"aggregate\":\"robot@0\",\"asOf\":0"));
        assertThat(displayed.get(2), startsWith("{\"aggregate\":\"forklift@0\",\"asOf\":0"));
        assertThat(displayed.get(3), startsWith("{\"aggregate\":\"coin-quarter@0\",\"asOf\":0"));
    }

    @Test
    public void dashboard_shows_every_update() {
        dashboard.start();
        scheduler.runPending();
        displayed.clear();

        log.append(FactoryTags.TOSS, Tossed.of(true));
        scheduler.runPending();

        assertEquals(1, displayed.size());
        assertThat(displayed.get(0), containsString("\"heads\":true"));
        assertThat(displayed.get(0), containsString("\"tosses\":1"));
    }

    @Test
    public void dashboard_never_emits() {
        log.append(FactoryTags.MACHINE, Produced.of(2));
        dashboard.start();
        scheduler.runPending();

        assertEquals(1, log.lastSequence());
    }

    @Test
    public void corrupted_twin_is_reported() {
        dashboard.start();
        scheduler.runPending();

        log.append(FactoryTags.FORKLIFT, Produced.of(1));
        scheduler.runPending();

        assertEquals(1, failures.size());
        assertTrue(failures.get(0).getMessage().contains("forklift@0"));
    }
}
