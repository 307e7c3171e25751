package com.tempo.webhook;

/**
 * Outcome of a single dispatch. Not persisted.
 */
public final class WebhookResult {
    public static final int SENTINEL_STATUS = 500;
    public static final String CREATE_FAILED = "Error creating request";
    public static final String SEND_FAILED = "Error sending request";

    public enum Kind {
        SUCCESS,
        REQUEST_ERROR,
        TRANSPORT_ERROR,
        HTTP_ERROR;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final Kind kind;
    private final int statusCode;
    private final String message;

    private WebhookResult(Kind kind, int statusCode, String message) {
        this.kind = kind;
        this.statusCode = statusCode;
        this.message = message;
    }

    public static WebhookResult success(int statusCode) {
        return new WebhookResult(Kind.SUCCESS, statusCode, ReasonPhrases.statusText(statusCode));
    }

    public static WebhookResult requestError() {
        return new WebhookResult(Kind.REQUEST_ERROR, SENTINEL_STATUS, CREATE_FAILED);
    }

    public static WebhookResult transportError() {
        return new WebhookResult(Kind.TRANSPORT_ERROR, SENTINEL_STATUS, SEND_FAILED);
    }

    public static WebhookResult httpError(int statusCode) {
        return new WebhookResult(Kind.HTTP_ERROR, statusCode, ReasonPhrases.statusText(statusCode));
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "WebhookResult{success, status=" + statusCode + "}";
        }
        return "webhook returned status code: " + statusCode + ", message: " + message;
    }
}
