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

/**
 * Exception generated when appending to or reading from the event log fails.
 */
public class EventLogException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * The store cannot be reached, the same append may succeed later.
         */
        UNAVAILABLE,
        /**
         * The store refused the event.
         */
        REJECTED,
        /**
         * The payload could not be converted to or from its stored form.
         */
        SERIALIZATION,
        /**
         * The log was closed.
         */
        CLOSED
    }

    protected EventLogException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isTransient() {
        return fault == Fault.UNAVAILABLE;
    }

    public static EventLogException unavailable(String tag, Throwable cause) {
        return new EventLogException(Fault.UNAVAILABLE, "Append of event tagged " + tag + " failed. "
                + (cause == null ? "Store unavailable" : cause.getMessage()), cause);
    }

    public static EventLogException rejected(String tag, String reason) {
        return new EventLogException(Fault.REJECTED, "Event tagged " + tag + " rejected: " + reason, null);
    }

    public static EventLogException unsupported(Object payload) {
        return new EventLogException(Fault.SERIALIZATION, "Unsupported payload type: " + payload, null);
    }

    public static EventLogException serializationFailed(String type, Throwable cause) {
        return new EventLogException(Fault.SERIALIZATION, "Payload of type " + type + " could not be serialized. "
                + cause.getMessage(), cause);
    }

    public static EventLogException deserializationFailed(long sequenceNo, String type, Throwable cause) {
        return new EventLogException(Fault.SERIALIZATION, "Event " + sequenceNo + " of type " + type
                + " could not be deserialized", cause);
    }

    public static EventLogException closed() {
        return new EventLogException(Fault.CLOSED, "Event log is closed", null);
    }
}
