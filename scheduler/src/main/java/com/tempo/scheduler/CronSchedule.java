package com.tempo.scheduler;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.tempo.exception.ValidationException;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * A parsed six-field cron expression: {@code second minute hour day-of-month month day-of-week}.
 * <p>
 * Day-of-week runs 0-7 with both 0 and 7 meaning Sunday. When day-of-month and day-of-week are
 * both restricted a time matches if either one does. {@code ?} is accepted in either day field and
 * means no restriction. Expressions that can never fire, such as February 30th, are rejected.
 */
public final class CronSchedule {
    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
            .withSeconds().withStrictRange().and()
            .withMinutes().withStrictRange().and()
            .withHours().withStrictRange().and()
            .withDayOfMonth().supportsQuestionMark().withStrictRange().and()
            .withMonth().withStrictRange().and()
            .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).supportsQuestionMark()
            .withIntMapping(7, 0).withStrictRange().and()
            .instance();
    private static final CronParser PARSER = new CronParser(DEFINITION);

    private final String expression;
    private final Cron cron;
    private final ExecutionTime executionTime;

    private CronSchedule(String expression, Cron cron) {
        this.expression = expression;
        this.cron = cron;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    /**
     * @throws ValidationException when the expression is blank, does not have six fields, has
     *                             values outside a field's range or matches no date at all
     */
    public static CronSchedule parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new ValidationException("cron expression is required");
        }
        int fields = expr.split("\\s+").length;
        if (fields != 6) {
            throw new ValidationException("expected exactly 6 fields, found " + fields + ": " + expr);
        }
        try {
            Cron cron = PARSER.parse(expr);
            cron.validate();
            CronSchedule schedule = new CronSchedule(expr, cron);
            if (schedule.nextExecution(ZonedDateTime.now(ZoneOffset.UTC)).isEmpty()) {
                throw new ValidationException("cron expression '" + expr + "' never fires");
            }
            return schedule;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Whether {@code time}, truncated to the second, is a firing moment. Depends on nothing but
     * the argument and the expression. Each call searches around {@code time}; the tick loop goes
     * through {@link Trigger#isDue}, which caches the next firing instead.
     */
    public boolean isDue(ZonedDateTime time) {
        return executionTime.isMatch(time.truncatedTo(ChronoUnit.SECONDS));
    }

    public Optional<ZonedDateTime> nextExecution(ZonedDateTime after) {
        return executionTime.nextExecution(after);
    }

    public String describe() {
        try {
            return CronDescriptor.instance(Locale.ENGLISH).describe(cron);
        } catch (RuntimeException e) {
            return expression;
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
