package com.indicationscout.evidence.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.indicationscout.evidence.domain.exception.DataSourceException;
import com.indicationscout.evidence.domain.exception.ExhaustedRetryException;
import com.indicationscout.evidence.domain.exception.MalformedResponseException;
import com.indicationscout.evidence.domain.exception.TerminalResponseException;
import com.indicationscout.evidence.domain.exception.TransientNetworkException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link RequestExecutor} over a Retrofit transport with resilience4j retry
 * and rate limiting.
 *
 * <p>Each attempt is classified as transient (I/O failure, timeout, status in
 * the retryable set), terminal (any other non-2xx) or successful. Only
 * transient attempts are retried, with capped exponential backoff. A 2xx body
 * that cannot be decoded is malformed and never retried.
 */
public class RetryingRequestExecutor implements RequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryingRequestExecutor.class);

    private static final int BODY_EXCERPT_LENGTH = 500;

    private final String source;
    private final EvidenceHttpApi api;
    private final RequestConfig config;
    private final ObjectMapper jsonMapper;
    private final XmlMapper xmlMapper;
    private final Retry retry;
    private final RateLimiter rateLimiter;

    public RetryingRequestExecutor(String source, EvidenceHttpApi api, RequestConfig config,
                                   ObjectMapper jsonMapper, XmlMapper xmlMapper) {
        this.source = source;
        this.api = api;
        this.config = config;
        this.jsonMapper = jsonMapper;
        this.xmlMapper = xmlMapper;
        this.retry = Retry.of(source, RetryConfig.custom()
                .maxAttempts(config.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.baseDelay().toMillis(), config.backoffMultiplier(), config.maxDelay().toMillis()))
                .retryOnException(TransientNetworkException.class::isInstance)
                .build());
        this.rateLimiter = RateLimiter.of(source, RateLimiterConfig.custom()
                .limitForPeriod(config.burst())
                .limitRefreshPeriod(config.rateLimitRefreshPeriod())
                .timeoutDuration(config.timeout())
                .build());

        retry.getEventPublisher().onRetry(event -> logger.warn(
                "Retrying [{}] after attempt {} in {}ms: {}",
                source, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    @Override
    public String sourceName() {
        return source;
    }

    @Override
    public JsonNode get(String operation, String path, Map<String, String> query) {
        String body = execute(operation, path, () -> api.get(path, query));
        return parse(jsonMapper, operation, body);
    }

    @Override
    public JsonNode graphQl(String operation, String path, String document, Map<String, Object> variables) {
        String body = execute(operation, path, () -> api.post(path, new GraphQlRequest(document, variables)));
        JsonNode root = parse(jsonMapper, operation, body);

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText(error.toString())));
            throw new TerminalResponseException(source, operation, "GraphQL errors: " + messages, 0);
        }

        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            throw new MalformedResponseException(source, operation, "GraphQL reply has no data member");
        }
        return data;
    }

    @Override
    public JsonNode getStructuredText(String operation, String path, Map<String, String> query) {
        String body = execute(operation, path, () -> api.get(path, query));
        return parse(xmlMapper, operation, body);
    }

    private String execute(String operation, String path, Supplier<Call<ResponseBody>> callFactory) {
        AtomicInteger attempt = new AtomicInteger();
        long start = System.nanoTime();
        try {
            String body = retry.executeCallable(() -> attempt(operation, path, attempt.incrementAndGet(), callFactory));
            logger.info("Success [{}.{}] attempts={} elapsed={}ms",
                    source, operation, attempt.get(), (System.nanoTime() - start) / 1_000_000);
            return body;
        } catch (TransientNetworkException e) {
            logger.error("All retries exhausted [{}.{}] after {} attempts: {}",
                    source, operation, attempt.get(), e.getMessage());
            throw new ExhaustedRetryException(e, attempt.get());
        } catch (DataSourceException e) {
            throw e;
        } catch (Exception e) {
            throw new DataSourceException(source, operation, "Unexpected failure: " + e.getMessage(), e);
        }
    }

    private String attempt(String operation, String path, int attemptNumber,
                           Supplier<Call<ResponseBody>> callFactory) {
        if (!rateLimiter.acquirePermission()) {
            throw new TransientNetworkException(source, operation,
                    "No request permit within " + config.timeout().toMillis() + "ms", 0, null);
        }

        logger.info("Request [{}.{}] attempt={} path={}", source, operation, attemptNumber, path);

        Response<ResponseBody> response;
        String body;
        try {
            response = callFactory.get().execute();
            if (response.isSuccessful()) {
                try (ResponseBody responseBody = response.body()) {
                    return responseBody != null ? responseBody.string() : "";
                }
            }
            try (ResponseBody errorBody = response.errorBody()) {
                body = errorBody != null ? excerpt(errorBody.string()) : "";
            }
        } catch (IOException e) {
            throw new TransientNetworkException(source, operation,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        int status = response.code();
        if (config.isRetryable(status)) {
            throw new TransientNetworkException(source, operation, "HTTP " + status + ": " + body, status, body);
        }
        throw new TerminalResponseException(source, operation, "HTTP " + status + ": " + body, status);
    }

    private JsonNode parse(ObjectMapper mapper, String operation, String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException(source, operation, "Empty response body");
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new MalformedResponseException(source, operation, "Empty response body");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(source, operation,
                    "Undecodable body: " + excerpt(body), e);
        }
    }

    private static String excerpt(String body) {
        return body.length() > BODY_EXCERPT_LENGTH ? body.substring(0, BODY_EXCERPT_LENGTH) : body;
    }
}
