package com.tempo.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import org.junit.Test;

import com.tempo.job.Job;

public class TriggerRegistryTest {
    private static final ZonedDateTime T0 = ZonedDateTime.of(2026, 10, 13, 8, 0, 0, 0, ZoneOffset.UTC);

    private static Job job(String id, String cron) {
        return Job.builder().id(id).url("http://localhost/" + id).cronExpr(cron).build();
    }

    private static TriggerHandle arm(TriggerRegistry registry, Job job) {
        return registry.arm(job, CronSchedule.parse(job.getCronExpr()));
    }

    @Test
    public void dueReturnsOnlyMatchingTriggers() {
        TriggerRegistry registry = new TriggerRegistry();
        arm(registry, job("every", "* * * * * *"));
        arm(registry, job("ten", "*/10 * * * * *"));

        assertThat(registry.dueAt(T0).size(), is(2));
        List<Trigger> due = registry.dueAt(T0.plusSeconds(3));
        assertThat(due.size(), is(1));
        assertThat(due.get(0).getJob().getId(), is("every"));
    }

    @Test
    public void armingSameIdReplaces() {
        TriggerRegistry registry = new TriggerRegistry();
        arm(registry, job("a", "*/10 * * * * *"));
        arm(registry, job("a", "* * * * * *"));

        assertThat(registry.size(), is(1));
        assertThat(registry.dueAt(T0.plusSeconds(3)).size(), is(1));
    }

    @Test
    public void staleHandleDoesNotCancelNewerTrigger() {
        TriggerRegistry registry = new TriggerRegistry();
        TriggerHandle first = arm(registry, job("a", "* * * * * *"));
        TriggerHandle second = arm(registry, job("a", "* * * * * *"));

        assertThat(first.cancel(), is(false));
        assertThat(registry.isArmed("a"), is(true));
        assertThat(second.cancel(), is(true));
        assertThat(registry.isArmed("a"), is(false));
        assertThat(second.cancel(), is(false));
    }

    @Test
    public void disarmAndClear() {
        TriggerRegistry registry = new TriggerRegistry();
        arm(registry, job("b", "* * * * * *"));
        arm(registry, job("a", "* * * * * *"));
        assertThat(registry.armedIds().toString(), is("[a, b]"));

        assertThat(registry.disarm("a"), is(true));
        assertThat(registry.disarm("a"), is(false));
        registry.clear();
        assertThat(registry.size(), is(0));
        assertThat(registry.dueAt(T0).isEmpty(), is(true));
    }

    @Test
    public void cachedNextFiringAgreesWithSchedule() {
        TriggerRegistry registry = new TriggerRegistry();
        for (String cron : new String[] {"*/7 * * * * *", "0 * * * * *", "30 59 7 * * *", "* * * * * *"}) {
            arm(registry, job(cron, cron));
        }
        ZonedDateTime start = T0.minusMinutes(2);
        for (int i = 0; i < 300; i++) {
            ZonedDateTime t = start.plusSeconds(i);
            for (Trigger trigger : registry.dueAt(t)) {
                assertThat(trigger + " at " + t, CronSchedule.parse(trigger.getJobId()).isDue(t), is(true));
            }
            assertThat("count at " + t, registry.dueAt(t).size(), is(expectedDue(t)));
        }
        // going back in time recomputes instead of reusing the cached firing
        assertThat(registry.dueAt(T0.minusSeconds(30)).size(), is(2));
    }

    private static int expectedDue(ZonedDateTime t) {
        int due = 1;
        if (t.getSecond() % 7 == 0)
            due++;
        if (t.getSecond() == 0)
            due++;
        if (t.getHour() == 7 && t.getMinute() == 59 && t.getSecond() == 30)
            due++;
        return due;
    }

    @Test
    public void armedTriggerKeepsItsOwnJob() {
        TriggerRegistry registry = new TriggerRegistry();
        Job original = job("a", "* * * * * *");
        arm(registry, original);
        assertThat(registry.dueAt(T0).get(0).getJob(), is(original));
    }
}
