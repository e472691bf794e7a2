package io.github.twinline.core.matching;

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
import io.github.twinline.core.TestPayloads.Added;
import io.github.twinline.core.TestPayloads.Multiplied;
import io.github.twinline.core.TestPayloads.Reset;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FoldSwitchTest {

    private final FoldSwitch<String, Object> fold = FoldSwitch.builder(String.class, Object.class)
            .on(Added.class, (s, e) -> s + "+" + e.getPayload().getAmount())
            .on(Multiplied.class, (s, e) -> s + "*" + e.getPayload().getFactor())
            .build();

    private static Event<Object> event(Object payload) {
        return new Event<>("test", payload, 1, Instant.EPOCH);
    }

    @Test
    public void branch_matching_payload_is_applied() {
        assertEquals("0+2", fold.apply("0", event(new Added(2))));
        assertEquals("0*3", fold.apply("0", event(new Multiplied(3))));
    }

    @Test
    public void first_matching_branch_wins() {
        FoldSwitch<String, Object> general = FoldSwitch.builder(String.class, Object.class)
                .on(Object.class, (s, e) -> "any")
                .on(Added.class, (s, e) -> "added")
                .build();

        assertEquals("any", general.apply("", event(new Added(1))));
    }

    @Test
    public void unmatched_payload_is_reported() {
        Event<Object> reset = event(new Reset());
        try {
            fold.apply("0", reset);
            fail("Reset is not handled");
        } catch (UnhandledEventException e) {
            assertSame(reset, e.getEvent());
        }
    }

    @Test
    public void handled_payloads_are_known() {
        assertTrue(fold.handles(new Added(1)));
        assertFalse(fold.handles(new Reset()));
    }

    @Test(expected = IllegalStateException.class)
    public void switch_needs_a_branch() {
        FoldSwitch.builder(String.class, Object.class).build();
    }
}
