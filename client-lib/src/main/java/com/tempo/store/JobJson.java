package com.tempo.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tempo.job.Job;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Jackson setup shared by the job store and the import/export commands.
 * Property names are matched case-insensitively so files written with Go-style field names
 * ({@code ID}, {@code URL}, {@code CronExpr}) load as-is.
 */
public final class JobJson {
    private static final TypeReference<List<Job>> JOB_LIST = new TypeReference<>() {
    };

    private JobJson() {
    }

    public static ObjectMapper mapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * @throws JsonMappingException when the array holds a {@code null} entry
     */
    public static List<Job> readJobs(ObjectMapper mapper, byte[] data) throws IOException {
        List<Job> jobs = mapper.readValue(data, JOB_LIST);
        if (jobs == null) {
            return List.of();
        }
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i) == null) {
                throw new JsonMappingException((Closeable) null, "null job entry at index " + i);
            }
        }
        return jobs;
    }

    public static byte[] writeJobs(ObjectMapper mapper, List<Job> jobs) throws IOException {
        return mapper.writeValueAsBytes(jobs);
    }
}
