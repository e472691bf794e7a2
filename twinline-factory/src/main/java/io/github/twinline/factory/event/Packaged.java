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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Units the robot moved from its input into the packaged buffer.
 */
@Value.Immutable
@FactoryStyle
@JsonSerialize(as = ImmutablePackaged.class)
@JsonDeserialize(as = ImmutablePackaged.class)
public interface Packaged extends FactoryEvent {
    int qty();

    static Packaged of(int qty) {
        return ImmutablePackaged.of(qty);
    }
}
