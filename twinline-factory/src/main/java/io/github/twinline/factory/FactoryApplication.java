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
import io.github.twinline.factory.FactoryRuntime.Program;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Command line entry point. Runs single program selected by the first argument until it fails.
 */
public class FactoryApplication {
    private static final Logger logger = LoggerFactory.getLogger(FactoryApplication.class);

    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;
    static final String DEBUG_VARIABLE = "TWINLINE_DEBUG";

    private final PrintStream err;

    FactoryApplication(PrintStream err) {
        this.err = err;
    }

    public static void main(String[] args) {
        enableDebugLogging(System.getenv(DEBUG_VARIABLE));
        System.exit(new FactoryApplication(System.err).run(args));
    }

    int run(String[] args) {
        Program program = args.length == 1 ? Program.of(args[0]) : null;
        if (program == null) {
            err.println(usage());
            return EXIT_USAGE;
        }
        try (FactoryRuntime runtime = new FactoryRuntime(FactoryConfiguration.load())) {
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "twinline-shutdown"));
            runtime.start(program);
            Throwable failure = runtime.awaitFailure();
            logger.error("Program {} terminates", program.argument(), failure);
            err.println("Program " + program.argument() + " failed: " + failure.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("Program {} failed to start", program.argument(), e);
            err.println("Program " + program.argument() + " failed to start: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static String usage() {
        return "Usage: FactoryApplication <" + Arrays.stream(Program.values()).map(Program::argument)
                .collect(Collectors.joining("|")) + ">\n"
                + "Set " + DEBUG_VARIABLE + "=true to log every state transition.";
    }

    /**
     * Switch loggers of the application to DEBUG level.
     * @param flag value of the debug variable
     * @return true if debug logging was enabled
     */
    static boolean enableDebugLogging(String flag) {
        if (!Boolean.parseBoolean(flag)) {
            return false;
        }
        ILoggerFactory loggerFactory = LoggerFactory.getILoggerFactory();
        if (!(loggerFactory instanceof LoggerContext)) {
            logger.warn("Cannot enable debug logging with {}", loggerFactory.getClass().getName());
            return false;
        }
        ((LoggerContext) loggerFactory).getLogger("io.github.twinline").setLevel(Level.DEBUG);
        return true;
    }
}
