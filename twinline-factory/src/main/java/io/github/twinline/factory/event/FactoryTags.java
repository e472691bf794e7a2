package io.github.twinline.factory.event;

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

import io.github.twinline.core.store.JacksonPayloadSerialization;

/**
 * Tags of the factory events.
 */
public final class FactoryTags {
    public static final String MACHINE = "machine";
    public static final String ROBOT = "robot";
    public static final String FORKLIFT = "forklift";
    public static final String TOSS = "toss";

    private FactoryTags() {
    }

    /**
     * Serialization of all factory payloads.
     * @return new serialization
     */
    public static JacksonPayloadSerialization serialization() {
        return new JacksonPayloadSerialization().register(Produced.class, PickedUp.class,
                PickedUpFromMachine.class, Packaged.class, DroppedOff.class, Tossed.class);
    }
}
