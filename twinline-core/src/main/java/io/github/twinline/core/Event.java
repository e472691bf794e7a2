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

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable fact stored in the {@linkplain io.github.twinline.core.store.EventLog event log}.
 *
 * <p>Every event is addressed by a single tag, and carries a payload. The event log assigns the sequence number and
 * timestamp at the time of append. Sequence numbers are strictly increasing within the whole log, and therefore also
 * within the stream of any single tag.</p>
 *
 * <p>Consumers only ever receive events from the log, they never construct them to represent a stored fact.</p>
 *
 * @param <P> type of payload
 */
public final class Event<P> {
    private final String tag;
    private final P payload;
    private final long sequenceNo;
    private final Instant timestamp;

    public Event(String tag, P payload, long sequenceNo, Instant timestamp) {
        this.tag = Objects.requireNonNull(tag, "Tag must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        if (sequenceNo < 1) {
            throw new IllegalArgumentException("Sequence number must be positive, was " + sequenceNo);
        }
        this.sequenceNo = sequenceNo;
    }

    public String getTag() {
        return tag;
    }

    public P getPayload() {
        return payload;
    }

    /**
     * Position of the event in the log.
     * @return sequence number assigned by the log, starting at 1
     */
    public long getSequenceNo() {
        return sequenceNo;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Payload type name as stored by the log.
     * @return the type name of the payload
     * @see EventType#of(Object)
     */
    public String getType() {
        return EventType.of(payload);
    }

    /**
     * View this event as event with more specific payload type.
     * @param payloadType expected payload class
     * @param <T> expected payload type
     * @return this event
     * @throws ClassCastException when payload is not of requested type
     */
    public <T> Event<T> as(Class<T> payloadType) {
        if (!payloadType.isInstance(payload)) {
            throw new ClassCastException("Event " + sequenceNo + " tagged " + tag + " carries " + getType()
                    + ", not " + payloadType.getSimpleName());
        }
        return (Event<T>) this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        Event<?> that = (Event<?>) o;

        if (sequenceNo != that.sequenceNo)
            return false;
        if (!tag.equals(that.tag))
            return false;
        return payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        int result = tag.hashCode();
        result = 31 * result + Long.hashCode(sequenceNo);
        return result;
    }

    @Override
    public String toString() {
        return "Event{" + "tag=" + tag + ", sequenceNo=" + sequenceNo + ", timestamp=" + timestamp + ", payload="
                + payload + '}';
    }
}
