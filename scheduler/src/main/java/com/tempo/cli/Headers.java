package com.tempo.cli;

import com.tempo.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Headers {
    private Headers() {
    }

    /**
     * Parses {@code Key=Value} pairs; the value may itself contain '='.
     */
    static Map<String, String> parse(List<String> pairs) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (pairs == null) {
            return headers;
        }
        for (String pair : pairs) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new ValidationException("invalid header format: " + pair + ". Use 'Key=Value'");
            }
            headers.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return headers;
    }
}
