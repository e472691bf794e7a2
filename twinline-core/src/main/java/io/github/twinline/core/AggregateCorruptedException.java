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
 * An event could not be applied to an aggregate. The aggregate cannot safely continue, and its updates are halted
 * until the log or the fold is remediated.
 */
public class AggregateCorruptedException extends RuntimeException {
    private final String aggregateKey;
    private final long sequenceNo;

    public AggregateCorruptedException(String aggregateKey, long sequenceNo, String message, Throwable cause) {
        super("Aggregate " + aggregateKey + " corrupted at event " + sequenceNo + ": " + message, cause);
        this.aggregateKey = aggregateKey;
        this.sequenceNo = sequenceNo;
    }

    public AggregateCorruptedException(String aggregateKey, long sequenceNo, Throwable cause) {
        this(aggregateKey, sequenceNo, String.valueOf(cause), cause);
    }

    public String getAggregateKey() {
        return aggregateKey;
    }

    /**
     * Sequence number of the event that could not be applied.
     */
    public long getSequenceNo() {
        return sequenceNo;
    }
}
