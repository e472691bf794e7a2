package io.github.twinline.core.store;

/*-
 * #%L
 * twinline-core
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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.twinline.core.EventType;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON serialization of registered payload types. The type discriminator is the {@linkplain EventType default type
 * name} of registered class, so payloads generated by Immutables are stored under the name of their abstract value
 * type.
 */
public class JacksonPayloadSerialization implements PayloadSerialization {
    static final int PAYLOAD_VERSION = 1;

    private final ObjectMapper mapper;
    private final Map<String, Class<?>> types = new LinkedHashMap<>();

    public JacksonPayloadSerialization() {
        this(defaultMapper());
    }

    public JacksonPayloadSerialization(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    /**
     * The mapper used for payloads and for rendering state.
     * @return new ObjectMapper with JDK8 and java.time support
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // allow for future changes in a payload
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Register payload types this serialization will accept.
     * @param payloadTypes the classes
     * @return this serialization
     */
    public JacksonPayloadSerialization register(Class<?>... payloadTypes) {
        for (Class<?> type : payloadTypes) {
            String name = EventType.defaultTypeName(type);
            Class<?> previous = types.putIfAbsent(name, type);
            if (previous != null && previous != type) {
                throw new IllegalArgumentException("Type name " + name + " of " + type.getName()
                        + " is already used by " + previous.getName());
            }
        }
        return this;
    }

    private Map.Entry<String, Class<?>> registration(Object payload) {
        if (payload == null) {
            return null;
        }
        for (Map.Entry<String, Class<?>> entry : types.entrySet()) {
            if (entry.getValue().isInstance(payload)) {
                return entry;
            }
        }
        return null;
    }

    @Override
    public boolean supports(Object payload) {
        return registration(payload) != null;
    }

    @Override
    public String typeOf(Object payload) {
        Map.Entry<String, Class<?>> registration = registration(payload);
        if (registration == null) {
            throw new IllegalArgumentException("Unsupported payload " + payload);
        }
        return registration.getKey();
    }

    @Override
    public int payloadVersion(Object payload) {
        return PAYLOAD_VERSION;
    }

    @Override
    public String serialize(Object payload) throws EventLogException {
        Map.Entry<String, Class<?>> registration = registration(payload);
        if (registration == null) {
            throw EventLogException.unsupported(payload);
        }
        try {
            return mapper.writerFor(registration.getValue()).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw EventLogException.serializationFailed(registration.getKey(), e);
        }
    }

    @Override
    public Object deserialize(int payloadVersion, String payload, String type) throws EventLogException {
        Class<?> target = types.get(type);
        if (target == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, target);
        } catch (IOException e) {
            throw EventLogException.serializationFailed(type, e);
        }
    }
}
