package com.tempo.cli;

import com.tempo.exception.ValidationException;

final class Formats {
    static final String JSON = "json";
    static final String YAML = "yaml";

    private Formats() {
    }

    static void requireJson(String format, String action) {
        String f = format == null ? JSON : format.trim().toLowerCase();
        if (YAML.equals(f)) {
            throw new ValidationException("YAML " + action + " not implemented yet");
        }
        if (!JSON.equals(f)) {
            throw new ValidationException("unsupported format: " + format);
        }
    }

    static String abbreviate(String s) {
        return s.length() <= 50 ? s : s.substring(0, 50) + "...";
    }
}
