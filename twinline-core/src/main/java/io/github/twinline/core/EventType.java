package io.github.twinline.core;

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

/**
 * Naming convention for payload types, as stored in the log next to serialized payload.
 */
public class EventType {
    private static final String IMMUTABLE_PREFIX = "Immutable";
    private static final String EVENT_SUFFIX = "Event";

    private EventType() {

    }

    public static String of(Object payload) {
        return defaultTypeName(payload.getClass());
    }

    /**
     * Default implementation of type name. Strips Immutable prefix, and suffix Event.
     * @param clazz the payload class
     * @return Simple name. ImmutableThingHappenedEvent becomes ThingHappened.
     */
    public static String defaultTypeName(Class<?> clazz) {
        return fromSimpleClassnameStripping(clazz.getSimpleName(), IMMUTABLE_PREFIX, EVENT_SUFFIX);
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) && simpleClassName.length() > prefix.length() ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) && simpleClassName.length() - suffix.length() > start
                ? simpleClassName.length() - suffix.length()
                : simpleClassName.length();
        return simpleClassName.substring(start, end);
    }
}
