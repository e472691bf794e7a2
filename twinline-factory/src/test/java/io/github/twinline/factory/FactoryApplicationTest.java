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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.After;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FactoryApplicationTest {
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final FactoryApplication application = new FactoryApplication(
            new PrintStream(output, true));

    private String err() {
        return new String(output.toByteArray(), StandardCharsets.UTF_8);
    }

    private static ch.qos.logback.classic.Logger twinlineLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger("io.github.twinline");
    }

    @After
    public void resetLogging() {
        twinlineLogger().setLevel(Level.WARN);
    }

    @Test
    public void missing_program_prints_usage() {
        assertEquals(FactoryApplication.EXIT_USAGE, application.run(new String[0]));
        assertThat(err(), containsString("Usage"));
        assertThat(err(), containsString("machine|robot|forklift|dashboard|cointoss|all"));
    }

    @Test
    public void unknown_program_prints_usage() {
        assertEquals(FactoryApplication.EXIT_USAGE, application.run(new String[] {"conveyor"}));
        assertThat(err(), containsString("Usage"));
    }

    @Test
    public void extra_arguments_print_usage() {
        assertEquals(FactoryApplication.EXIT_USAGE, application.run(new String[] {"machine", "robot"}));
    }

    @Test
    public void debug_logging_is_enabled_by_flag() {
        assertFalse(FactoryApplication.enableDebugLogging(null));
        assertFalse(FactoryApplication.enableDebugLogging("no"));
        assertEquals(Level.WARN, twinlineLogger().getLevel());

        assertTrue(FactoryApplication.enableDebugLogging("true"));
        assertEquals(Level.DEBUG, twinlineLogger().getLevel());
    }
}
