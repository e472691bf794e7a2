package io.github.twinline.factory;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.twinline.core.AggregateSnapshot;
import io.github.twinline.core.store.JacksonPayloadSerialization;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single line JSON rendering of twin states for humans.
 */
public final class StateRendering {
    private static final ObjectMapper mapper = JacksonPayloadSerialization.defaultMapper();

    private StateRendering() {
    }

    public static String json(Object state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot render " + state, e);
        }
    }

    /**
     * Render snapshot as {@code {"aggregate":"machine@0","asOf":12,"state":{...}}}.
     * @param snapshot the snapshot
     * @return JSON text
     */
    public static String json(AggregateSnapshot<?> snapshot) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        rendered.put("aggregate", snapshot.getKey());
        rendered.put("asOf", snapshot.getAsOfSequence());
        rendered.put("state", snapshot.getValue());
        return json((Object) rendered);
    }
}
