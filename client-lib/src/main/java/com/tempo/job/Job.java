package com.tempo.job;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tempo.exception.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named webhook call plus the cron expression that drives it.
 * <p>
 * Instances are immutable; the header map is copied on construction so a job handed to the
 * scheduler never changes underneath it when the store is edited.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "url", "cronExpr", "method", "body", "headers"})
public final class Job {
    public static final String DEFAULT_METHOD = "GET";

    private final String id;
    private final String url;
    private final String cronExpr;
    private final String method;
    private final String body;
    private final Map<String, String> headers;

    @JsonCreator
    public Job(@JsonProperty("id") String id,
               @JsonProperty("url") String url,
               @JsonProperty("cronExpr") @JsonAlias("CronExpr") String cronExpr,
               @JsonProperty("method") String method,
               @JsonProperty("body") String body,
               @JsonProperty("headers") Map<String, String> headers) {
        this.id = id;
        this.url = url;
        this.cronExpr = cronExpr;
        this.method = (method == null || method.isBlank()) ? DEFAULT_METHOD : method;
        this.body = body == null ? "" : body;
        this.headers = headers == null || headers.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public String getCronExpr() {
        return cronExpr;
    }

    public String getMethod() {
        return method;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Checks the fields every stored job needs: id, url and a schedule. The schedule itself is
     * parsed only when the job is armed.
     */
    public Job requireSchedulable() {
        requireDispatchable();
        if (id == null || id.isBlank()) {
            throw new ValidationException("job ID is required");
        }
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new ValidationException("schedule is required for job '" + id + "'");
        }
        return this;
    }

    /**
     * Checks the fields a one-off call needs.
     */
    public Job requireDispatchable() {
        if (url == null || url.isBlank()) {
            throw new ValidationException("URL is required" + (id == null ? "" : " for job '" + id + "'"));
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job)) {
            return false;
        }
        Job other = (Job) o;
        return Objects.equals(id, other.id)
                && Objects.equals(url, other.url)
                && Objects.equals(cronExpr, other.cronExpr)
                && Objects.equals(method, other.method)
                && Objects.equals(body, other.body)
                && Objects.equals(headers, other.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, url, cronExpr, method, body, headers);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", method=" + method + ", url=" + url + ", cronExpr=" + cronExpr + "}";
    }

    public static final class Builder {
        private String id;
        private String url;
        private String cronExpr;
        private String method = DEFAULT_METHOD;
        private String body = "";
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder cronExpr(String cronExpr) {
            this.cronExpr = cronExpr;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Job build() {
            return new Job(id, url, cronExpr, method, body, headers);
        }
    }
}
