package com.tempo.webhook;

import java.util.HashMap;
import java.util.Map;

/**
 * Standard reason phrases. {@link java.net.http.HttpResponse} does not carry the one the server
 * sent, so status text is rebuilt from the code.
 */
final class ReasonPhrases {
    private static final Map<Integer, String> PHRASES = new HashMap<>();

    static {
        PHRASES.put(200, "OK");
        PHRASES.put(201, "Created");
        PHRASES.put(202, "Accepted");
        PHRASES.put(204, "No Content");
        PHRASES.put(301, "Moved Permanently");
        PHRASES.put(302, "Found");
        PHRASES.put(304, "Not Modified");
        PHRASES.put(307, "Temporary Redirect");
        PHRASES.put(308, "Permanent Redirect");
        PHRASES.put(400, "Bad Request");
        PHRASES.put(401, "Unauthorized");
        PHRASES.put(403, "Forbidden");
        PHRASES.put(404, "Not Found");
        PHRASES.put(405, "Method Not Allowed");
        PHRASES.put(408, "Request Timeout");
        PHRASES.put(409, "Conflict");
        PHRASES.put(410, "Gone");
        PHRASES.put(413, "Payload Too Large");
        PHRASES.put(415, "Unsupported Media Type");
        PHRASES.put(422, "Unprocessable Entity");
        PHRASES.put(429, "Too Many Requests");
        PHRASES.put(500, "Internal Server Error");
        PHRASES.put(501, "Not Implemented");
        PHRASES.put(502, "Bad Gateway");
        PHRASES.put(503, "Service Unavailable");
        PHRASES.put(504, "Gateway Timeout");
    }

    private ReasonPhrases() {
    }

    /**
     * "404 Not Found" style text, or just the code when no phrase is known.
     */
    static String statusText(int statusCode) {
        String phrase = PHRASES.get(statusCode);
        return phrase == null ? String.valueOf(statusCode) : statusCode + " " + phrase;
    }
}
