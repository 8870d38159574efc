package org.smtflat.encoder.junit.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is allowed with
 * {@link AllowLog} or expected with {@link ExpectLog}. Expected events that
 * never occur fail the test as well.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = resolveRules(context);
        CapturingFilter filter = new CapturingFilter(rules);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter == null) return;
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event e : filter.events) {
                if (!rules.tolerates(e)) problems.add("Unexpected log: " + e);
            }
        }
        for (ExpectLog exp : rules.expects) {
            long count = filter.events.stream().filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())).count();
            if (count < exp.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<AnnotatedElement> scopes = new ArrayList<>();
        context.getTestClass().ifPresent(scopes::add);
        context.getTestClass().map(Class::getEnclosingClass).ifPresent(scopes::add);
        context.getElement().ifPresent(scopes::add);

        FailOnLog fail = null;
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        for (AnnotatedElement scope : scopes) {
            FailOnLog f = scope.getAnnotation(FailOnLog.class);
            if (f != null) fail = f;
            allows.addAll(List.of(scope.getAnnotationsByType(AllowLog.class)));
            if (scope == context.getElement().orElse(null)) {
                expects.addAll(List.of(scope.getAnnotationsByType(ExpectLog.class)));
            }
        }
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(minLevel, disabled, allows, expects);
    }

    private static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(level.toLogback())
                && Pattern.matches(loggerPattern, e.logger)
                && Pattern.matches(messagePattern, e.message);
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean tolerates(Event e) {
            for (AllowLog a : allows) {
                if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) return true;
            }
            for (ExpectLog x : expects) {
                if (matches(e, x.level(), x.loggerPattern(), x.messagePattern())) return true;
            }
            return false;
        }
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(rules.minLevel().toLogback())) {
                return FilterReply.NEUTRAL;
            }
            Event e = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(e);
            return rules.tolerates(e) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
