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
 * Conversion of event payloads into String form a durable log can store.
 * <p>We expect that during lifetime of the project, the serialization scenarios might change. Whenever the serialized
 * object changes in incompatible manner, serialization should start using different unique payload version for it.</p>
 * <p>Payload version will be stored separately by the store, and will be provided to method
 * {@link #deserialize(int, String, String)}. Usually an application writes into most recent payload version, however
 * needs to be able to read the past versions of the object.</p>
 */
public interface PayloadSerialization {

    /**
     * Check that the payload can be stored.
     * @param payload payload to check
     * @return true if this serialization can serialize the payload
     */
    boolean supports(Object payload);

    /**
     * Type discriminator stored next to the payload.
     * @param payload supported payload
     * @return type name
     */
    String typeOf(Object payload);

    /**
     * Determine version of payload to be used for serialization.
     * @param payload object to be serialized
     * @return payload version.
     */
    int payloadVersion(Object payload);

    /**
     * Serialize the object into a String payload.
     * @param payload object to serialize
     * @return String serialization of the object
     * @throws EventLogException when the payload cannot be serialized
     */
    String serialize(Object payload) throws EventLogException;

    /**
     * Deserialize a payload given its version and type.
     *
     * @param payloadVersion the version of the payload as stored in the store
     * @param payload payload to deserialize
     * @param type the type discriminator stored with the payload
     * @return deserialized object, or {@code null} when the type is not known to this serialization
     * @throws EventLogException when the type is known, but payload is malformed
     */
    Object deserialize(int payloadVersion, String payload, String type) throws EventLogException;
}
