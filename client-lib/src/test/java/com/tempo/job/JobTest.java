package com.tempo.job;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.tempo.exception.ValidationException;

public class JobTest {

    @Test
    public void headersAreCopiedOnConstruction() {
        Map<String, String> headers = new HashMap<>();
        headers.put("X-A", "1");
        Job job = new Job("a", "http://localhost/a", "* * * * * *", "POST", "", headers);
        headers.put("X-B", "2");

        assertThat(job.getHeaders().size(), is(1));
        assertThrows(UnsupportedOperationException.class, () -> job.getHeaders().put("X-C", "3"));
    }

    @Test
    public void blankMethodDefaultsToGet() {
        assertThat(new Job("a", "http://localhost/a", "* * * * * *", " ", null, null).getMethod(), is("GET"));
        assertThat(Job.builder().id("a").url("u").method(null).build().getMethod(), is("GET"));
    }

    @Test
    public void methodIsNotNormalised() {
        assertThat(Job.builder().id("a").url("u").method("purge").build().getMethod(), is("purge"));
    }

    @Test
    public void missingUrlIsRejected() {
        Job job = Job.builder().id("a").cronExpr("* * * * * *").build();
        ValidationException ex = assertThrows(ValidationException.class, job::requireSchedulable);
        assertThat(ex.getMessage(), is("URL is required for job 'a'"));
    }

    @Test
    public void missingScheduleIsRejected() {
        Job job = Job.builder().id("a").url("http://localhost/a").build();
        assertThrows(ValidationException.class, job::requireSchedulable);
        assertThat(job.requireDispatchable(), is(job));
    }

    @Test
    public void missingIdIsRejected() {
        Job job = Job.builder().url("http://localhost/a").cronExpr("* * * * * *").build();
        ValidationException ex = assertThrows(ValidationException.class, job::requireSchedulable);
        assertThat(ex.getMessage(), is("job ID is required"));
    }

    @Test
    public void equalityCoversEveryField() {
        Job a = Job.builder().id("a").url("u").cronExpr("c").body("b").header("h", "v").build();
        Job b = Job.builder().id("a").url("u").cronExpr("c").body("b").header("h", "v").build();
        Job c = Job.builder().id("a").url("u").cronExpr("c").body("b").header("h", "other").build();
        assertThat(a.equals(b), is(true));
        assertThat(a.hashCode(), is(b.hashCode()));
        assertThat(a.equals(c), is(false));
    }
}
