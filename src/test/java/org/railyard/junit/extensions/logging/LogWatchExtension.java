package org.railyard.junit.extensions.logging;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.platform.commons.support.AnnotationSupport;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

/**
 * Watches the log during each test.
 * <p>
 * The test fails if it logs a WARN or ERROR event that no {@link ExpectLog} or
 * {@link AllowLog} on the method or class covers, or if an {@link ExpectLog} is not
 * satisfied.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String APPENDER = "appender";

    @Override
    public void beforeEach(ExtensionContext context) {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.setName("log-watch");
        appender.start();
        rootLogger().addAppender(appender);
        context.getStore(NAMESPACE).put(APPENDER, appender);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void afterEach(ExtensionContext context) {
        ListAppender<ILoggingEvent> appender = context.getStore(NAMESPACE).remove(APPENDER, ListAppender.class);
        if (appender == null) {
            return;
        }
        rootLogger().detachAppender(appender);
        appender.stop();
        List<ILoggingEvent> events;
        synchronized (appender) {
            events = new ArrayList<>(appender.list);
        }

        List<ExpectLog> expected = new ArrayList<>();
        List<AllowLog> allowed = new ArrayList<>();
        collect(context.getRequiredTestClass(), expected, allowed);
        collect(context.getRequiredTestMethod(), expected, allowed);

        List<String> failures = new ArrayList<>();
        for (ExpectLog expectation : expected) {
            long count = events.stream()
                    .filter(e -> matches(e, expectation.level(), expectation.messagePattern(), expectation.loggerPattern()))
                    .count();
            boolean satisfied = expectation.occurrences() < 0 ? count > 0 : count == expectation.occurrences();
            if (!satisfied) {
                failures.add(String.format("Expected %s %s log matching '%s' but found %d",
                        expectation.occurrences() < 0 ? "at least one" : String.valueOf(expectation.occurrences()),
                        expectation.level(), expectation.messagePattern(), count));
            }
        }
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) {
                continue;
            }
            boolean covered = expected.stream().anyMatch(x -> matches(event, x.level(), x.messagePattern(), x.loggerPattern()))
                    || allowed.stream().anyMatch(a -> matches(event, a.level(), a.messagePattern(), a.loggerPattern()));
            if (!covered) {
                failures.add(String.format("Unexpected %s log from %s: %s",
                        event.getLevel(), event.getLoggerName(), event.getFormattedMessage()));
            }
        }
        if (!failures.isEmpty()) {
            throw new AssertionError(String.join(System.lineSeparator(), failures));
        }
    }

    private static void collect(AnnotatedElement element, List<ExpectLog> expected, List<AllowLog> allowed) {
        expected.addAll(AnnotationSupport.findRepeatableAnnotations(element, ExpectLog.class));
        allowed.addAll(AnnotationSupport.findRepeatableAnnotations(element, AllowLog.class));
    }

    private static boolean matches(ILoggingEvent event, LogLevel level, String messagePattern, String loggerPattern) {
        return event.getLevel().equals(level.toLogback())
                && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.getFormattedMessage()).matches()
                && Pattern.compile(loggerPattern).matcher(event.getLoggerName()).matches();
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
