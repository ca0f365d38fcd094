package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.exception.ReportValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Set;

/**
 * Standard five-field cron (minute hour day-of-month month day-of-week) on top of Spring's
 * six-field {@link CronExpression}, which carries a leading seconds field.
 */
public final class CronExpressions {

    private static final Set<String> MACROS = Set.of(
            "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly"
    );

    private CronExpressions() {
    }

    public static String toSpringExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ReportValidationException("Invalid cron expression: expression is empty");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            String macro = trimmed.toLowerCase(Locale.ROOT);
            if (!MACROS.contains(macro)) {
                throw new ReportValidationException("Invalid cron expression: unrecognized descriptor " + trimmed);
            }
            return macro;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new ReportValidationException(
                    "Invalid cron expression: expected exactly 5 fields, found " + fields.length + ": " + trimmed);
        }
        return "0 " + String.join(" ", fields);
    }

    public static CronExpression parse(String expression) {
        String springExpression = toSpringExpression(expression);
        try {
            return CronExpression.parse(springExpression);
        } catch (IllegalArgumentException ex) {
            throw new ReportValidationException("Invalid cron expression: " + ex.getMessage(), ex);
        }
    }

    /**
     * Parses and also rejects expressions that can never fire, such as {@code 0 0 30 2 *}.
     */
    public static CronExpression parseSchedulable(String expression, ZoneId zone) {
        CronExpression cron = parse(expression);
        if (cron.next(ZonedDateTime.now(zone)) == null) {
            throw new ReportValidationException("Invalid cron expression: never fires: " + expression.trim());
        }
        return cron;
    }
}
