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
import io.github.twinline.core.loop.LoopContext;
import io.github.twinline.factory.FactoryConfiguration;
import io.github.twinline.factory.event.DroppedOff;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.PickedUp;

import static io.github.twinline.factory.twin.FactoryTwins.FORKLIFT;
import static io.github.twinline.factory.twin.FactoryTwins.ROBOT;

/**
 * Drains all packages of the robot in one trip, and then cools down before the next one.
 */
public class ForkliftLoop extends ControlLoop {
    public static final String DROP_OFF = "drop-off";

    public ForkliftLoop(LoopContext context, FactoryConfiguration config) {
        super("forklift", context);
        observe(ROBOT);
        observe(FORKLIFT);
        action(DROP_OFF, states -> states.get(ROBOT).packagedQty() > 0, states -> {
            int qty = states.get(ROBOT).packagedQty();
            return ActionPlan.after(config.dropOffDelay())
                    .emit(FactoryTags.ROBOT, PickedUp.of(qty))
                    .emit(FactoryTags.FORKLIFT, DroppedOff.of(qty))
                    .coolDown(config.forkliftCoolDown())
                    .announce(qty + " packages")
                    .build();
        });
    }
}
