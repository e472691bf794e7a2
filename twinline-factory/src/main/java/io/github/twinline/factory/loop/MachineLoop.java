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
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.Produced;
import io.github.twinline.factory.twin.Machine;

import static io.github.twinline.factory.twin.FactoryTwins.MACHINE;

/**
 * Produces into the machine buffer while it is below capacity.
 */
public class MachineLoop extends ControlLoop {
    public static final String PRODUCE = "produce";

    private final int capacity;

    public MachineLoop(LoopContext context, FactoryConfiguration config) {
        super("machine", context);
        this.capacity = config.machineCapacity();
        observe(MACHINE);
        action(PRODUCE, states -> belowCapacity(states.get(MACHINE)),
                states -> ActionPlan.after(config.produceDelay())
                        .emit(FactoryTags.MACHINE, Produced.of(config.produceQty()))
                        .build());
    }

    boolean belowCapacity(Machine machine) {
        if (machine.bufferQty() > capacity) {
            logger.warn("Machine buffer {} exceeds capacity {}", machine.bufferQty(), capacity);
        }
        return machine.bufferQty() < capacity;
    }
}
