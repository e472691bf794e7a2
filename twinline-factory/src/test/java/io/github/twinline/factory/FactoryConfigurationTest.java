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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FactoryConfigurationTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Properties properties(String... keyValues) {
        Properties result = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            result.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return result;
    }

    @Test
    public void defaults_are_loaded_from_classpath() {
        FactoryConfiguration config = FactoryConfiguration.load(new Properties());

        assertFalse(config.isMemoryLog());
        assertThat(config.logUrl(), containsString("jdbc:h2:"));
        assertEquals(3, config.machineCapacity());
        assertEquals(Duration.ofSeconds(1), config.produceDelay());
        assertEquals(2, config.pickupQty());
        assertEquals(9, config.robotInputCapacity());
        assertEquals(5, config.robotPackagedCapacity());
        assertEquals(Duration.ofSeconds(5), config.forkliftCoolDown());
        assertEquals(Duration.ofSeconds(2), config.tossDelay());
        assertEquals(Duration.ofMillis(200), config.pollInterval());
        assertTrue(config.strictLog());
    }

    @Test
    public void overrides_replace_defaults() {
        FactoryConfiguration config = FactoryConfiguration.load(properties(
                "twinline.log.url", "memory",
                "twinline.machine.capacity", "7",
                "unrelated.machine.capacity", "1"));

        assertTrue(config.isMemoryLog());
        assertEquals(7, config.machineCapacity());
    }

    @Test
    public void configuration_file_is_applied_before_overrides() throws IOException {
        File file = folder.newFile("factory.properties");
        Files.write(file.toPath(), Arrays.asList("twinline.machine.capacity=4", "twinline.toss.delay=100"),
                StandardCharsets.UTF_8);

        FactoryConfiguration config = FactoryConfiguration.load(properties(
                FactoryConfiguration.CONFIG_FILE_PROPERTY, file.getPath(),
                "twinline.toss.delay", "50"));

        assertEquals(4, config.machineCapacity());
        assertEquals(Duration.ofMillis(50), config.tossDelay());
    }

    @Test
    public void missing_configuration_file_is_reported() {
        try {
            FactoryConfiguration.load(properties(FactoryConfiguration.CONFIG_FILE_PROPERTY,
                    new File(folder.getRoot(), "missing.properties").getPath()));
            fail("Missing file should be reported");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("missing.properties"));
        }
    }

    @Test
    public void invalid_value_names_its_key() {
        FactoryConfiguration config = FactoryConfiguration.load(properties("twinline.machine.capacity", "many"));
        try {
            config.machineCapacity();
            fail("Invalid number should be reported");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("twinline.machine.capacity"));
        }
    }

    @Test
    public void value_below_minimum_is_refused() {
        FactoryConfiguration config = FactoryConfiguration.load(properties("twinline.log.poll-interval", "0"));
        try {
            config.pollInterval();
            fail("Poll interval must be positive");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("twinline.log.poll-interval"));
        }
    }

    @Test
    public void single_attempt_means_no_retries() {
        assertSame(RetryStrategy.noRetries(),
                FactoryConfiguration.load(properties("twinline.retry.attempts", "1")).retryStrategy());
        assertNotSame(RetryStrategy.noRetries(), FactoryConfiguration.load(new Properties()).retryStrategy());
    }
}
