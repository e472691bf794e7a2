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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.twinline.factory.event.FactoryStyle;
import org.immutables.value.Value;

@Value.Immutable
@FactoryStyle
@JsonSerialize(as = ImmutableForklift.class)
@JsonDeserialize(as = ImmutableForklift.class)
public interface Forklift {
    int deliveredQty();
    int trips();

    static Forklift of(int deliveredQty, int trips) {
        return ImmutableForklift.of(deliveredQty, trips);
    }
}
