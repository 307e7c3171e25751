package com.tempo.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.junit.Test;

import com.tempo.exception.ValidationException;

public class CronScheduleTest {
    private static final ZonedDateTime MIDNIGHT = ZonedDateTime.of(2026, 10, 13, 0, 0, 0, 0, ZoneOffset.UTC);

    @Test
    public void everyFifthSecond() {
        CronSchedule s = CronSchedule.parse("*/5 * * * * *");
        for (int sec = 0; sec < 60; sec++) {
            assertThat("second " + sec, s.isDue(MIDNIGHT.withSecond(sec)), is(sec % 5 == 0));
        }
    }

    @Test
    public void everySecondMatchesAnyTime() {
        CronSchedule s = CronSchedule.parse("* * * * * *");
        assertThat(s.isDue(MIDNIGHT), is(true));
        assertThat(s.isDue(MIDNIGHT.plusHours(13).plusSeconds(7)), is(true));
    }

    @Test
    public void subSecondPartIsIgnored() {
        CronSchedule s = CronSchedule.parse("30 * * * * *");
        assertThat(s.isDue(MIDNIGHT.withSecond(30).withNano(999_000_000)), is(true));
    }

    @Test
    public void resultDependsOnlyOnInput() {
        CronSchedule a = CronSchedule.parse("0 */15 9-17 * * 1-5");
        CronSchedule b = CronSchedule.parse("0 */15 9-17 * * 1-5");
        ZonedDateTime t = MIDNIGHT.withHour(9).withMinute(45);
        assertThat(a.isDue(t), is(true));
        assertThat(a.isDue(t), is(b.isDue(t)));
        assertThat(a.isDue(t.withSecond(1)), is(false));
    }

    @Test
    public void weekdayNamesAndNumbers() {
        // 2026-10-13 is a Tuesday
        assertThat(CronSchedule.parse("0 0 0 * * 2").isDue(MIDNIGHT), is(true));
        assertThat(CronSchedule.parse("0 0 0 * * 3").isDue(MIDNIGHT), is(false));
    }

    @Test
    public void sundayIsZeroOrSeven() {
        ZonedDateTime sunday = MIDNIGHT.plusDays(5);
        assertThat(CronSchedule.parse("0 0 0 * * 0").isDue(sunday), is(true));
        assertThat(CronSchedule.parse("0 0 0 * * 7").isDue(sunday), is(true));
        assertThat(CronSchedule.parse("0 0 0 * * 7").isDue(MIDNIGHT), is(false));
    }

    @Test
    public void restrictedDayFieldsMatchEither() {
        CronSchedule s = CronSchedule.parse("0 0 12 13 * 5");
        ZonedDateTime noon = MIDNIGHT.withHour(12);
        assertThat("13th, a Tuesday", s.isDue(noon), is(true));
        assertThat("16th, a Friday", s.isDue(noon.withDayOfMonth(16)), is(true));
        assertThat("14th, a Wednesday", s.isDue(noon.withDayOfMonth(14)), is(false));
    }

    @Test
    public void rejectsMalformedExpressions() {
        for (String expr : new String[] {"not a cron", "* * * * *", "* * * * * * *", "60 * * * * *",
                "* 60 * * * *", "* * 24 * * *", "* * * 32 * *", "* * * * 13 *", "* * * * * 8", "", "   "}) {
            assertThrows(expr, ValidationException.class, () -> CronSchedule.parse(expr));
            assertThat(expr, CronSchedule.isValid(expr), is(false));
        }
        assertThrows(ValidationException.class, () -> CronSchedule.parse(null));
    }

    @Test
    public void questionMarkLeavesDayFieldOpen() {
        ZonedDateTime tuesdayNoon = MIDNIGHT.withHour(12);
        CronSchedule byWeekday = CronSchedule.parse("0 0 12 ? * 2");
        assertThat(byWeekday.isDue(tuesdayNoon), is(true));
        assertThat(byWeekday.isDue(tuesdayNoon.plusDays(1)), is(false));

        CronSchedule byDate = CronSchedule.parse("0 0 12 13 * ?");
        assertThat(byDate.isDue(tuesdayNoon), is(true));
        assertThat(byDate.isDue(tuesdayNoon.plusDays(7)), is(false));
    }

    @Test
    public void datesThatNeverOccurAreRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> CronSchedule.parse("0 0 12 30 2 *"));
        assertThat(ex.getMessage(), is("cron expression '0 0 12 30 2 *' never fires"));
        assertThat(CronSchedule.isValid("0 0 0 31 4 *"), is(false));
        assertThat(CronSchedule.isValid("0 0 0 31 5 *"), is(true));
    }

    @Test
    public void fieldCountIsReported() {
        ValidationException ex = assertThrows(ValidationException.class, () -> CronSchedule.parse("* * * * *"));
        assertThat(ex.getMessage(), is("expected exactly 6 fields, found 5: * * * * *"));
    }

    @Test
    public void nextExecutionFollowsSchedule() {
        CronSchedule s = CronSchedule.parse("0 30 9 * * *");
        assertThat(s.nextExecution(MIDNIGHT).get(), is(MIDNIGHT.withHour(9).withMinute(30)));
        assertThat(s.nextExecution(MIDNIGHT.withHour(10)).get(), is(MIDNIGHT.plusDays(1).withHour(9).withMinute(30)));
    }

    @Test
    public void keepsTrimmedExpression() {
        CronSchedule s = CronSchedule.parse("  */30 * * * * *  ");
        assertThat(s.getExpression(), is("*/30 * * * * *"));
        assertThat(s.toString(), is("*/30 * * * * *"));
        assertThat(s.describe().isEmpty(), is(false));
    }
}
