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
import io.github.twinline.factory.StateRendering;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.Tossed;

import java.util.Random;

import static io.github.twinline.factory.twin.FactoryTwins.COIN;

/**
 * Tosses the coin again whenever the previous toss is observed.
 */
public class CoinTossLoop extends ControlLoop {
    public static final String TOSS = "toss";

    public CoinTossLoop(LoopContext context, FactoryConfiguration config) {
        this(context, config, new Random());
    }

    public CoinTossLoop(LoopContext context, FactoryConfiguration config, Random random) {
        super("cointoss", context);
        observe(COIN);
        action(TOSS, states -> true, states -> ActionPlan.after(config.tossDelay())
                .emit(FactoryTags.TOSS, Tossed.of(random.nextBoolean()))
                .announceOnEmit("coin toss state " + StateRendering.json(states.get(COIN)))
                .build());
    }
}
