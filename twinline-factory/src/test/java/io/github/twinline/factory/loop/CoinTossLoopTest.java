package io.github.twinline.factory.loop;

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
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.twinline.core.Event;
import io.github.twinline.core.TagFilter;
import io.github.twinline.core.store.EventLog;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.event.Tossed;
import io.github.twinline.factory.twin.Coin;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.github.twinline.factory.twin.FactoryTwins.COIN;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

public class CoinTossLoopTest extends LoopTestSupport {
    private static final long SEED = 42;

    private final CoinTossLoop loop = new CoinTossLoop(context, config("twinline.toss.delay", "2000"),
            new Random(SEED));

    private final List<ILoggingEvent> logged = new CopyOnWriteArrayList<>();
    private final AppenderBase<ILoggingEvent> appender = new AppenderBase<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            logged.add(event);
        }
    };

    @Before
    public void setUp() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        appender.setContext(ctx);
        appender.start();
        ctx.getLogger(CoinTossLoop.class).setLevel(Level.INFO);
        ctx.getLogger(CoinTossLoop.class).addAppender(appender);
    }

    @After
    public void tearDown() {
        loop.close();
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(CoinTossLoop.class).detachAppender(appender);
        ctx.getLogger(CoinTossLoop.class).setLevel(null);
        appender.stop();
    }

    private List<String> announcements() {
        return logged.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .filter(m -> m.contains("coin toss state"))
                .collect(toList());
    }

    private List<Event<Object>> tosses() {
        List<Event<Object>> result = new ArrayList<>();
        try (EventLog.StoredEvents events = log.readEvents(TagFilter.tag(FactoryTags.TOSS), 0)) {
            events.foreach(result::add);
        }
        return result;
    }

    @Test
    public void coin_is_tossed_every_two_seconds() {
        loop.start();

        scheduler.advance(Duration.ofMillis(1999));
        assertEquals(0, tosses().size());

        scheduler.advance(Duration.ofMillis(1));
        assertEquals(1, tosses().size());

        scheduler.advance(Duration.ofMillis(8000));
        assertEquals(5, tosses().size());
    }

    @Test
    public void coin_shows_the_last_toss() {
        Random expected = new Random(SEED);
        loop.start();

        scheduler.advance(Duration.ofSeconds(10));

        boolean last = false;
        for (int i = 0; i < 5; i++) {
            last = expected.nextBoolean();
        }
        assertEquals(Coin.of(last, 5), stateOf(COIN));
        assertEquals(Tossed.of(last), tosses().get(4).getPayload());
    }

    @Test
    public void state_is_announced_when_toss_is_emitted() {
        loop.start();

        scheduler.advance(Duration.ofMillis(1999));
        assertEquals(0, announcements().size());

        scheduler.advance(Duration.ofMillis(1));
        assertEquals(1, announcements().size());
        assertThat(announcements().get(0), containsString("emits toss"));
    }
}
