// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.core;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogSinkTest {

    private final Logger connectionLogger = (Logger) LoggerFactory.getLogger(LogSink.CONNECTION_LOGGER);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        appender.start();
        connectionLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        connectionLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void testDefaultSinkLogsAtInfoOnConnectionLogger() {
        LogSink.slf4j().write("[10.0.0.1] open session s1");

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertEquals(LogSink.CONNECTION_LOGGER, event.getLoggerName());
        assertEquals("[10.0.0.1] open session s1", event.getFormattedMessage());
    }

    @Test
    void testLineIsNotInterpretedAsPattern() {
        LogSink.slf4j().write("braces {} stay {}");

        assertEquals("braces {} stay {}", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void testCustomLoggerIsUsed() {
        Logger custom = (Logger) LoggerFactory.getLogger("sh.pulse.test.custom");
        ListAppender<ILoggingEvent> customAppender = new ListAppender<>();
        customAppender.start();
        custom.addAppender(customAppender);
        try {
            LogSink.slf4j(custom).write("hello");

            assertEquals(1, customAppender.list.size());
            assertTrue(appender.list.isEmpty());
        } finally {
            custom.detachAppender(customAppender);
        }
    }
}
