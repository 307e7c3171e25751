package com.tempo.webhook;

import com.tempo.job.Job;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link Dispatcher} on top of {@link HttpClient}.
 * <p>
 * The method string is forwarded verbatim and the body is sent for every method when it is not
 * empty. The response body is discarded, never buffered. No retries happen here; see the
 * scheduler's retry policy for the opt-in variant.
 */
@Slf4j
public class HttpWebhookDispatcher implements Dispatcher {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final Duration timeout;
    private final DispatchMetrics metrics;

    public HttpWebhookDispatcher() {
        this(DEFAULT_TIMEOUT, DispatchMetrics.noop());
    }

    public HttpWebhookDispatcher(Duration timeout, DispatchMetrics metrics) {
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.metrics = metrics == null ? DispatchMetrics.noop() : metrics;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public WebhookResult dispatch(Job job) {
        log.info("[webhook] calling {} {}, body: {}, headers: {}", job.getMethod(), job.getUrl(), job.getBody(),
                job.getHeaders());
        long t0 = System.nanoTime();
        WebhookResult result = call(job);
        metrics.observeDispatch(result.getKind(), (System.nanoTime() - t0) / 1_000_000_000.0);
        return result;
    }

    private WebhookResult call(Job job) {
        HttpRequest request;
        try {
            request = buildRequest(job);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("[webhook] error creating request for job {}: {}", job.getId(), e.getMessage());
            return WebhookResult.requestError();
        }

        HttpResponse<Void> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            log.warn("[webhook] error sending request for job {}: {}", job.getId(), e.toString());
            return WebhookResult.transportError();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[webhook] interrupted while sending request for job {}", job.getId());
            return WebhookResult.transportError();
        }

        int status = response.statusCode();
        if (status >= 400) {
            return WebhookResult.httpError(status);
        }
        log.info("[webhook] response for job {}: {} {} {}", job.getId(), ReasonPhrases.statusText(status),
                response.version(), response.headers().map());
        return WebhookResult.success(status);
    }

    private HttpRequest buildRequest(Job job) {
        HttpRequest.BodyPublisher publisher = job.getBody().isEmpty()
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(job.getBody());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(job.getUrl()))
                .timeout(timeout)
                .method(job.getMethod(), publisher);
        for (Map.Entry<String, String> header : job.getHeaders().entrySet()) {
            try {
                builder.header(header.getKey(), header.getValue());
            } catch (IllegalArgumentException e) {
                // restricted (Host, Content-Length, ...) or malformed names are set by the client itself
                log.warn("[webhook] skipping header '{}' for job {}: {}", header.getKey(), job.getId(),
                        e.getMessage());
            }
        }
        return builder.build();
    }
}
