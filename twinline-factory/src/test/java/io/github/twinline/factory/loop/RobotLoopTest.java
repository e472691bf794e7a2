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
import io.github.twinline.factory.event.PickedUpFromMachine;
import io.github.twinline.factory.event.Produced;
import io.github.twinline.factory.twin.Machine;
import io.github.twinline.factory.twin.Robot;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;

import static io.github.twinline.factory.twin.FactoryTwins.MACHINE;
import static io.github.twinline.factory.twin.FactoryTwins.ROBOT;
import static org.junit.Assert.assertEquals;

public class RobotLoopTest extends LoopTestSupport {
    private final RobotLoop loop = new RobotLoop(context, config(
            "twinline.robot.pickup.minimum", "1",
            "twinline.robot.pickup.qty", "2",
            "twinline.robot.pickup.delay", "1500",
            "twinline.robot.input.capacity", "9",
            "twinline.robot.packaged.capacity", "5",
            "twinline.robot.package.qty", "1",
            "twinline.robot.package.delay", "1000"));

    private void fillMachine() {
        for (int i = 0; i < 3; i++) {
            append(FactoryTags.MACHINE, Produced.of(1));
        }
    }

    @After
    public void tearDown() {
        loop.close();
    }

    @Test
    public void robot_picks_up_from_machine_buffer() {
        fillMachine();
        loop.start();
        scheduler.runPending();
        assertEquals(ActionState.RUNNING, loop.stateOf(RobotLoop.PICK_UP));
        assertEquals(ActionState.IDLE, loop.stateOf(RobotLoop.PACKAGE));

        scheduler.advance(Duration.ofMillis(1500));

        assertEquals(Machine.of(1), stateOf(MACHINE));
        assertEquals(Robot.of(2, 0), stateOf(ROBOT));
        // the remaining unit is not above the minimum
        assertEquals(ActionState.IDLE, loop.stateOf(RobotLoop.PICK_UP));
        assertEquals(ActionState.RUNNING, loop.stateOf(RobotLoop.PACKAGE));
    }

    @Test
    public void robot_packages_picked_up_units_one_by_one() {
        fillMachine();
        loop.start();
        scheduler.advance(Duration.ofMillis(1500));

        scheduler.advance(Duration.ofMillis(1000));
        assertEquals(Robot.of(1, 1), stateOf(ROBOT));

        scheduler.advance(Duration.ofSeconds(10));
        assertEquals(Robot.of(0, 2), stateOf(ROBOT));
        assertEquals(ActionState.IDLE, loop.stateOf(RobotLoop.PACKAGE));
    }

    @Test
    public void robot_with_full_input_does_not_pick_up() {
        fillMachine();
        append(FactoryTags.ROBOT, PickedUpFromMachine.of(9));
        long before = log.lastSequence();
        loop.start();
        scheduler.runPending();

        assertEquals(ActionState.IDLE, loop.stateOf(RobotLoop.PICK_UP));
        assertEquals(before, log.lastSequence());
    }

    @Test
    public void robot_stops_packaging_when_packaged_storage_is_full() {
        // nothing to pick up, the machine is empty
        append(FactoryTags.ROBOT, PickedUpFromMachine.of(9));
        loop.start();

        scheduler.advance(Duration.ofSeconds(30));

        assertEquals(Robot.of(4, 5), stateOf(ROBOT));
        assertEquals(ActionState.IDLE, loop.stateOf(RobotLoop.PACKAGE));
    }
}
