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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Selects the events of the log an aggregate or subscription is interested in.
 */
@FunctionalInterface
public interface TagFilter {

    boolean accepts(String tag);

    default boolean accepts(Event<?> event) {
        return accepts(event.getTag());
    }

    default TagFilter or(TagFilter other) {
        Objects.requireNonNull(other);
        return tag -> accepts(tag) || other.accepts(tag);
    }

    static TagFilter tag(String tag) {
        return anyOf(tag);
    }

    static TagFilter anyOf(String... tags) {
        if (tags.length == 0) {
            throw new IllegalArgumentException("At least one tag is required");
        }
        return new Tags(new LinkedHashSet<>(Arrays.asList(tags)));
    }

    static TagFilter all() {
        return tag -> true;
    }

    /**
     * Filter accepting an explicit set of tags.
     */
    final class Tags implements TagFilter {
        private final Set<String> tags;

        private Tags(Set<String> tags) {
            this.tags = Collections.unmodifiableSet(tags);
        }

        @Override
        public boolean accepts(String tag) {
            return tags.contains(tag);
        }

        public Set<String> getTags() {
            return tags;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tags && tags.equals(((Tags) o).tags);
        }

        @Override
        public int hashCode() {
            return tags.hashCode();
        }

        @Override
        public String toString() {
            return "Tags" + tags;
        }
    }
}
