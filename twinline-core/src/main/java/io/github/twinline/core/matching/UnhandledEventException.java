package io.github.twinline.core.matching;

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

import io.github.twinline.core.Event;

/**
 * No branch of a {@link FoldSwitch} handles the payload of an event.
 */
public class UnhandledEventException extends RuntimeException {
    private final transient Event<?> event;

    public UnhandledEventException(Event<?> event) {
        super("No fold for " + event.getType() + " of event " + event.getSequenceNo() + " tagged " + event.getTag());
        this.event = event;
    }

    public Event<?> getEvent() {
        return event;
    }
}
