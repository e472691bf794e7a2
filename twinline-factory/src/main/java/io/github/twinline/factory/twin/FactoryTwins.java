package io.github.twinline.factory.twin;

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

import io.github.twinline.core.AggregateDefinition;
import io.github.twinline.core.TagFilter;
import io.github.twinline.core.matching.FoldSwitch;
import io.github.twinline.factory.event.DroppedOff;
import io.github.twinline.factory.event.FactoryEvent;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.Packaged;
import io.github.twinline.factory.event.PickedUp;
import io.github.twinline.factory.event.PickedUpFromMachine;
import io.github.twinline.factory.event.Produced;
import io.github.twinline.factory.event.Tossed;

/**
 * Aggregates of the factory. Folds keep the facts of the log as they are, quantities are never clamped to
 * capacities.
 */
public final class FactoryTwins {

    public static final AggregateDefinition<Machine, FactoryEvent> MACHINE = AggregateDefinition.of("machine", 0,
            TagFilter.tag(FactoryTags.MACHINE), FactoryEvent.class, Machine.of(0),
            FoldSwitch.builder(Machine.class, FactoryEvent.class)
                    .on(Produced.class, (state, event) -> Machine.of(state.bufferQty() + event.getPayload().qty()))
                    .on(PickedUp.class, (state, event) -> Machine.of(state.bufferQty() - event.getPayload().qty()))
                    .build());

    public static final AggregateDefinition<Robot, FactoryEvent> ROBOT = AggregateDefinition.of("robot", 0,
            TagFilter.tag(FactoryTags.ROBOT), FactoryEvent.class, Robot.of(0, 0),
            FoldSwitch.builder(Robot.class, FactoryEvent.class)
                    .on(PickedUpFromMachine.class, (state, event) ->
                            Robot.of(state.inputQty() + event.getPayload().qty(), state.packagedQty()))
                    .on(Packaged.class, (state, event) -> Robot.of(state.inputQty() - event.getPayload().qty(),
                            state.packagedQty() + event.getPayload().qty()))
                    .on(PickedUp.class, (state, event) ->
                            Robot.of(state.inputQty(), state.packagedQty() - event.getPayload().qty()))
                    .build());

    public static final AggregateDefinition<Forklift, FactoryEvent> FORKLIFT = AggregateDefinition.of("forklift", 0,
            TagFilter.tag(FactoryTags.FORKLIFT), FactoryEvent.class, Forklift.of(0, 0),
            FoldSwitch.builder(Forklift.class, FactoryEvent.class)
                    .on(DroppedOff.class, (state, event) ->
                            Forklift.of(state.deliveredQty() + event.getPayload().qty(), state.trips() + 1))
                    .build());

    public static final AggregateDefinition<Coin, FactoryEvent> COIN = AggregateDefinition.of("coin-quarter", 0,
            TagFilter.tag(FactoryTags.TOSS), FactoryEvent.class, Coin.of(false, 0),
            FoldSwitch.builder(Coin.class, FactoryEvent.class)
                    .on(Tossed.class, (state, event) -> Coin.of(event.getPayload().heads(), state.tosses() + 1))
                    .build());

    private FactoryTwins() {
    }
}
