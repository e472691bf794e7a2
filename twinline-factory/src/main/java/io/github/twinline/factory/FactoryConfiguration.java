package io.github.twinline.factory;

/*-
 * #%L
 * twinline-factory
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

import io.github.twinline.core.loop.RetryStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Settings of the factory programs. Values of {@code twinline.properties} on the classpath are overridden by the
 * file named by system property {@value #CONFIG_FILE_PROPERTY}, which are overridden by system properties with
 * the same keys. Durations are in milliseconds.
 */
public class FactoryConfiguration {
    public static final String CONFIG_FILE_PROPERTY = "twinline.config";
    public static final String MEMORY_LOG = "memory";
    static final String DEFAULTS_RESOURCE = "twinline.properties";
    static final String PREFIX = "twinline.";

    private final Properties properties;

    public FactoryConfiguration(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load configuration with overrides from system properties.
     * @return the configuration
     */
    public static FactoryConfiguration load() {
        return load(System.getProperties());
    }

    /**
     * Load configuration.
     * @param overrides properties overriding the defaults, may name configuration file in
     *                  {@value #CONFIG_FILE_PROPERTY}
     * @return the configuration
     * @throws IllegalArgumentException when the configuration file cannot be read
     */
    public static FactoryConfiguration load(Properties overrides) {
        Properties result = new Properties();
        try (InputStream defaults = FactoryConfiguration.class.getClassLoader()
                .getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (defaults != null) {
                result.load(defaults);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
        String file = overrides.getProperty(CONFIG_FILE_PROPERTY);
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8)) {
                result.load(reader);
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read configuration file " + file + " named by "
                        + CONFIG_FILE_PROPERTY, e);
            }
        }
        for (String key : overrides.stringPropertyNames()) {
            if (key.startsWith(PREFIX) && !key.equals(CONFIG_FILE_PROPERTY)) {
                result.setProperty(key, overrides.getProperty(key));
            }
        }
        return new FactoryConfiguration(result);
    }

    public String logUrl() {
        return required("twinline.log.url");
    }

    public boolean isMemoryLog() {
        return MEMORY_LOG.equals(logUrl());
    }

    public String logUser() {
        return properties.getProperty("twinline.log.user", "");
    }

    public String logPassword() {
        return properties.getProperty("twinline.log.password", "");
    }

    public Duration pollInterval() {
        return positiveDuration("twinline.log.poll-interval");
    }

    public boolean strictLog() {
        return Boolean.parseBoolean(properties.getProperty("twinline.log.strict", "true"));
    }

    public int machineCapacity() {
        return number("twinline.machine.capacity", 1);
    }

    public int produceQty() {
        return number("twinline.machine.produce.qty", 1);
    }

    public Duration produceDelay() {
        return duration("twinline.machine.produce.delay");
    }

    public int pickupMinimum() {
        return number("twinline.robot.pickup.minimum", 0);
    }

    public int pickupQty() {
        return number("twinline.robot.pickup.qty", 1);
    }

    public Duration pickupDelay() {
        return duration("twinline.robot.pickup.delay");
    }

    public int robotInputCapacity() {
        return number("twinline.robot.input.capacity", 1);
    }

    public int robotPackagedCapacity() {
        return number("twinline.robot.packaged.capacity", 1);
    }

    public int packageQty() {
        return number("twinline.robot.package.qty", 1);
    }

    public Duration packageDelay() {
        return duration("twinline.robot.package.delay");
    }

    public Duration dropOffDelay() {
        return duration("twinline.forklift.dropoff.delay");
    }

    public Duration forkliftCoolDown() {
        return duration("twinline.forklift.cooldown");
    }

    public Duration tossDelay() {
        return duration("twinline.toss.delay");
    }

    public RetryStrategy retryStrategy() {
        int attempts = number("twinline.retry.attempts", 1);
        if (attempts == 1) {
            return RetryStrategy.noRetries();
        }
        return RetryStrategy.fixedRetries(attempts, duration("twinline.retry.delay").toMillis(),
                TimeUnit.MILLISECONDS);
    }

    private String required(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing configuration " + key);
        }
        return value.trim();
    }

    private long longValue(String key, long minimum) {
        String value = required(key);
        long result;
        try {
            result = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration " + key + " is not a number: " + value, e);
        }
        if (result < minimum) {
            throw new IllegalArgumentException("Configuration " + key + " must be at least " + minimum + ", was "
                    + result);
        }
        return result;
    }

    private int number(String key, int minimum) {
        long value = longValue(key, minimum);
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Configuration " + key + " is too large: " + value);
        }
        return (int) value;
    }

    private Duration duration(String key) {
        return Duration.ofMillis(longValue(key, 0));
    }

    private Duration positiveDuration(String key) {
        return Duration.ofMillis(longValue(key, 1));
    }
}
