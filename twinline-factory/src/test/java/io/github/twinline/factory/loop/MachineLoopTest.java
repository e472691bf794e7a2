package io.github.twinline.factory.loop;

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

import io.github.twinline.core.loop.ActionState;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.PickedUp;
import io.github.twinline.factory.event.Produced;
import io.github.twinline.factory.twin.Machine;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;

import static io.github.twinline.factory.twin.FactoryTwins.MACHINE;
import static org.junit.Assert.assertEquals;

public class MachineLoopTest extends LoopTestSupport {
    private final MachineLoop loop = new MachineLoop(context, config(
            "twinline.machine.capacity", "3",
            "twinline.machine.produce.qty", "1",
            "twinline.machine.produce.delay", "1000"));

    @After
    public void tearDown() {
        loop.close();
    }

    @Test
    public void machine_produces_until_buffer_is_full() {
        loop.start();

        scheduler.advance(Duration.ofSeconds(10));

        assertEquals(Machine.of(3), stateOf(MACHINE));
        assertEquals(3, log.lastSequence());
        assertEquals(ActionState.IDLE, loop.stateOf(MachineLoop.PRODUCE));
    }

    @Test
    public void each_unit_takes_the_production_delay() {
        loop.start();

        scheduler.advance(Duration.ofMillis(2500));

        assertEquals(Machine.of(2), stateOf(MACHINE));
        assertEquals(ActionState.RUNNING, loop.stateOf(MachineLoop.PRODUCE));
    }

    @Test
    public void production_resumes_when_units_are_picked_up() {
        loop.start();
        scheduler.advance(Duration.ofSeconds(10));

        append(FactoryTags.MACHINE, PickedUp.of(2));
        scheduler.advance(Duration.ofMillis(1500));
        assertEquals(Machine.of(2), stateOf(MACHINE));

        scheduler.advance(Duration.ofSeconds(10));
        assertEquals(Machine.of(3), stateOf(MACHINE));
    }

    @Test
    public void buffer_over_capacity_is_kept_as_recorded() {
        append(FactoryTags.MACHINE, Produced.of(5));
        loop.start();

        scheduler.advance(Duration.ofSeconds(10));

        assertEquals(Machine.of(5), stateOf(MACHINE));
        assertEquals(1, log.lastSequence());
    }
}
