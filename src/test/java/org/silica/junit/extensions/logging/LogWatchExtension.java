package org.silica.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails it when an {@link ExpectLog} event does not occur.
 * <p>
 * One turbo filter is installed per test class; its rules are replaced before every test
 * method and its captured events are cleared after every test method.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filterOf(context);
        if (filter != null) {
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filterOf(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (!rules.covers(event)) {
                    unexpected.add(event.toString());
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (Rule expected : rules.expects) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                missing.add(String.format("Expected %d x %s, but found %d.", expected.occurrences, expected, count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filterOf(ExtensionContext context) {
        return context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            if (!level.isGreaterOrEqual(current.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message == null ? "" : message);
            events.add(event);
            // covered events stay out of the test output
            return current.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rule(Level level, Pattern logger, Pattern message, int occurrences) {
        static Rule of(AllowLog allow) {
            return new Rule(toLogback(allow.level()), Pattern.compile(allow.loggerPattern()),
                    Pattern.compile(allow.messagePattern()), 0);
        }

        static Rule of(ExpectLog expect) {
            return new Rule(toLogback(expect.level()), Pattern.compile(expect.loggerPattern()),
                    Pattern.compile(expect.messagePattern()), expect.occurrences());
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                    && logger.matcher(event.loggerName).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, logger, message);
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Rule> allows = new ArrayList<>();
        final List<Rule> expects = new ArrayList<>();

        private Rules(Level minLevel, boolean disabled) {
            this.minLevel = minLevel;
            this.disabled = disabled;
        }

        static Rules resolve(ExtensionContext context) {
            Optional<AnnotatedElement> method = context.getElement()
                    .filter(element -> context.getTestMethod().isPresent());
            Optional<Class<?>> testClass = context.getTestClass();

            FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                    .orElse(testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            Rules rules = new Rules(toLogback(fail != null ? fail.level() : LogLevel.WARN),
                    fail != null && fail.disabled());

            // class-level rules first, then the method's own
            for (AnnotatedElement element : List.<AnnotatedElement>of(testClass.orElse(Object.class),
                    method.orElse(Object.class))) {
                for (AllowLog allow : element.getAnnotationsByType(AllowLog.class)) {
                    rules.allows.add(Rule.of(allow));
                }
                for (ExpectLog expect : element.getAnnotationsByType(ExpectLog.class)) {
                    rules.expects.add(Rule.of(expect));
                }
            }
            return rules;
        }

        boolean covers(Event event) {
            return allows.stream().anyMatch(rule -> rule.matches(event))
                    || expects.stream().anyMatch(rule -> rule.matches(event));
        }
    }
}
