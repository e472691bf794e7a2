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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a started action will do. Emissions are computed from the states observed when the action starts, and
 * are appended after the processing delay.
 */
public final class ActionPlan {
    private final Duration delay;
    private final List<Emission> emissions;
    private final Duration coolDown;
    private final String startMessage;
    private final String emitMessage;

    private ActionPlan(Builder b) {
        this.delay = b.delay;
        this.emissions = Collections.unmodifiableList(new ArrayList<>(b.emissions));
        this.coolDown = b.coolDown;
        this.startMessage = b.startMessage;
        this.emitMessage = b.emitMessage;
    }

    /**
     * Start building a plan.
     * @param delay simulated duration of the work
     * @return builder of the plan
     */
    public static Builder after(Duration delay) {
        return new Builder(delay);
    }

    public Duration getDelay() {
        return delay;
    }

    public List<Emission> getEmissions() {
        return emissions;
    }

    /**
     * Period after the action settled, during which the action will not start again.
     * @return cool-down, {@link Duration#ZERO} for none
     */
    public Duration getCoolDown() {
        return coolDown;
    }

    /**
     * @return message to log when action starts, may be null
     */
    public String getStartMessage() {
        return startMessage;
    }

    /**
     * @return message to log when the delay elapsed and events are emitted, may be null
     */
    public String getEmitMessage() {
        return emitMessage;
    }

    @Override
    public String toString() {
        return "after " + delay + " emit " + emissions
                + (coolDown.isZero() ? "" : ", cool down " + coolDown);
    }

    public static class Builder {
        private final Duration delay;
        private final List<Emission> emissions = new ArrayList<>();
        private Duration coolDown = Duration.ZERO;
        private String startMessage;
        private String emitMessage;

        Builder(Duration delay) {
            this.delay = Objects.requireNonNull(delay, "Delay must be specified");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay must not be negative");
            }
        }

        public Builder emit(String tag, Object payload) {
            emissions.add(Emission.of(tag, payload));
            return this;
        }

        public Builder coolDown(Duration coolDown) {
            this.coolDown = Objects.requireNonNull(coolDown);
            if (coolDown.isNegative()) {
                throw new IllegalArgumentException("Cool-down must not be negative");
            }
            return this;
        }

        public Builder announce(String startMessage) {
            this.startMessage = startMessage;
            return this;
        }

        public Builder announceOnEmit(String emitMessage) {
            this.emitMessage = emitMessage;
            return this;
        }

        public ActionPlan build() {
            if (emissions.isEmpty()) {
                throw new IllegalStateException("Action plan emits no events");
            }
            return new ActionPlan(this);
        }
    }
}
