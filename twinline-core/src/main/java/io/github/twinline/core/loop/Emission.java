package io.github.twinline.core.loop;

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

import java.util.Objects;

/**
 * Event an action appends to the log when its processing delay elapses.
 */
public final class Emission {
    private final String tag;
    private final Object payload;

    private Emission(String tag, Object payload) {
        this.tag = Objects.requireNonNull(tag, "Tag must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified");
    }

    public static Emission of(String tag, Object payload) {
        return new Emission(tag, payload);
    }

    public String getTag() {
        return tag;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Emission)) {
            return false;
        }
        Emission that = (Emission) o;
        return tag.equals(that.tag) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, payload);
    }

    @Override
    public String toString() {
        return tag + ": " + payload;
    }
}
