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

import io.github.twinline.core.loop.ActionPlan;
import io.github.twinline.core.loop.ControlLoop;
import io.github.twinline.core.loop.LatestStates;
import io.github.twinline.core.loop.LoopContext;
import io.github.twinline.factory.FactoryConfiguration;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.Packaged;
import io.github.twinline.factory.event.PickedUp;
import io.github.twinline.factory.event.PickedUpFromMachine;
import io.github.twinline.factory.twin.Machine;
import io.github.twinline.factory.twin.Robot;

import static io.github.twinline.factory.twin.FactoryTwins.MACHINE;
import static io.github.twinline.factory.twin.FactoryTwins.ROBOT;

/**
 * Moves units from the machine buffer into robot input, and packages them.
 */
public class RobotLoop extends ControlLoop {
    public static final String PICK_UP = "pick-up";
    public static final String PACKAGE = "package";

    private final FactoryConfiguration config;

    public RobotLoop(LoopContext context, FactoryConfiguration config) {
        super("robot", context);
        this.config = config;
        observe(MACHINE);
        observe(ROBOT);
        action(PICK_UP, this::canPickUp, this::planPickUp);
        action(PACKAGE, this::canPackage, this::planPackage);
    }

    boolean canPickUp(LatestStates states) {
        Machine machine = states.get(MACHINE);
        Robot robot = states.get(ROBOT);
        if (robot.inputQty() > config.robotInputCapacity()) {
            logger.warn("Robot input {} exceeds capacity {}", robot.inputQty(), config.robotInputCapacity());
        }
        return machine.bufferQty() > config.pickupMinimum() && robot.inputQty() < config.robotInputCapacity();
    }

    ActionPlan planPickUp(LatestStates states) {
        Machine machine = states.get(MACHINE);
        Robot robot = states.get(ROBOT);
        int qty = Math.min(config.pickupQty(),
                Math.min(machine.bufferQty(), config.robotInputCapacity() - robot.inputQty()));
        if (qty <= 0) {
            return null;
        }
        return ActionPlan.after(config.pickupDelay())
                .emit(FactoryTags.MACHINE, PickedUp.of(qty))
                .emit(FactoryTags.ROBOT, PickedUpFromMachine.of(qty))
                .announce(qty + " from machine buffer of " + machine.bufferQty())
                .build();
    }

    boolean canPackage(LatestStates states) {
        Robot robot = states.get(ROBOT);
        if (robot.packagedQty() > config.robotPackagedCapacity()) {
            logger.warn("Robot packaged {} exceeds capacity {}", robot.packagedQty(), config.robotPackagedCapacity());
        }
        return robot.inputQty() > 0 && robot.packagedQty() < config.robotPackagedCapacity();
    }

    ActionPlan planPackage(LatestStates states) {
        Robot robot = states.get(ROBOT);
        int qty = Math.min(config.packageQty(),
                Math.min(robot.inputQty(), config.robotPackagedCapacity() - robot.packagedQty()));
        if (qty <= 0) {
            return null;
        }
        return ActionPlan.after(config.packageDelay())
                .emit(FactoryTags.ROBOT, Packaged.of(qty))
                .build();
    }
}
