package com.example.OfferScan.service;

import com.example.OfferScan.config.AnalysisProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisErrorContext;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.exception.AnalysisHttpException;
import com.example.OfferScan.util.JsonValues;
import com.example.OfferScan.util.Texts;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Transport to the remote analysis service: auth/organization headers, per-attempt timeout,
 * error classification and bounded retry of transient failures.
 */
@Component
public class AnalysisHttpClient {

    private static final Logger log = LoggerFactory.getLogger(AnalysisHttpClient.class);

    static final String ORGANIZATION_HEADER = "X-Organization-Id";
    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String ERROR_CODE_HEADER = "x-error-code";
    static final String NOT_FOUND_HINT = "document not found / sprawdź endpoint";

    private static final int BODY_PREVIEW_LIMIT = 512;
    private static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
    private static final Pattern ABSOLUTE_URL = Pattern.compile("^https?://.*", Pattern.CASE_INSENSITIVE);

    private final WebClient client;
    private final AnalysisProperties props;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public AnalysisHttpClient(WebClient.Builder builder, AnalysisProperties props, ObjectMapper objectMapper) {
        int maxInMem = (int) Math.min(Integer.MAX_VALUE, props.getMaxArchiveBytes());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMem))
                .build();

        this.client = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                .exchangeStrategies(strategies)
                .build();
        this.props = props;
        this.objectMapper = objectMapper;
        this.baseUrl = resolveBaseUrl(props.getBaseUrl());
    }

    public Mono<HttpExchange<JsonNode>> requestJson(HttpMethod method, String pathOrUrl, Object body, RequestOptions options) {
        return execute(method, pathOrUrl, body, options, (resp, ctx) -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(text -> {
                    ctx.log(resp.statusCode().value(), Texts.cut(text, BODY_PREVIEW_LIMIT));
                    return parseJson(text, ctx, resp.statusCode().value());
                }));
    }

    public Mono<HttpExchange<byte[]>> requestBytes(String pathOrUrl, RequestOptions options) {
        return execute(HttpMethod.GET, pathOrUrl, null, options, (resp, ctx) -> resp.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .doOnNext(bytes -> ctx.log(resp.statusCode().value(), "[binary " + bytes.length + " bytes]"))
                .onErrorMap(DataBufferLimitException.class, ex -> new AnalysisException(
                        AnalysisErrorCode.ARCHIVE_ERROR,
                        "Result archive exceeds " + props.getMaxArchiveBytes() + " bytes",
                        AnalysisErrorContext.ofEndpoint(ctx.endpoint(), ctx.requestId()),
                        ex)));
    }

    private <T> Mono<HttpExchange<T>> execute(
            HttpMethod method,
            String pathOrUrl,
            Object body,
            RequestOptions options,
            BodyReader<T> reader
    ) {
        RequestOptions opts = options == null ? RequestOptions.defaults() : options;
        String endpoint = buildUrl(pathOrUrl);
        String requestId = UUID.randomUUID().toString();
        Duration timeout = resolveTimeout(opts.timeout());

        Mono<HttpExchange<T>> attempt = Mono.defer(() -> {
            ExchangeContext ctx = new ExchangeContext(method, endpoint, requestId, System.nanoTime());

            WebClient.RequestBodySpec spec = client.method(method)
                    .uri(URI.create(endpoint))
                    .headers(h -> applyHeaders(h, opts, requestId, body != null));
            WebClient.RequestHeadersSpec<?> request = body == null ? spec : spec.bodyValue(body);

            return request.exchangeToMono(resp -> handleResponse(resp, ctx, reader))
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, ex -> {
                        ctx.log(0, "[timeout]");
                        return new AnalysisHttpException(AnalysisErrorCode.TIMEOUT,
                                "Analysis request timed out after " + timeout.toMillis() + "ms",
                                504, endpoint, requestId, null, null, ex);
                    })
                    .onErrorMap(ex -> !(ex instanceof AnalysisException), ex -> {
                        ctx.log(0, "[" + ex.getClass().getSimpleName() + "]");
                        return new AnalysisHttpException(AnalysisErrorCode.HTTP_ERROR,
                                "Analysis request failed before receiving a response: " + ex.getMessage(),
                                0, endpoint, requestId, null, null, ex);
                    });
        });

        return attempt.retryWhen(retrySpec(method, endpoint));
    }

    private <T> Mono<HttpExchange<T>> handleResponse(ClientResponse resp, ExchangeContext ctx, BodyReader<T> reader) {
        int status = resp.statusCode().value();
        if (!resp.statusCode().is2xxSuccessful()) {
            return resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(text -> {
                        String preview = Texts.cut(text, BODY_PREVIEW_LIMIT);
                        ctx.log(status, preview);
                        return Mono.error(toHttpError(resp, status, ctx, text, preview));
                    });
        }
        return reader.read(resp, ctx)
                .map(data -> new HttpExchange<>(data, status, ctx.requestId(), ctx.endpoint()));
    }

    private AnalysisHttpException toHttpError(ClientResponse resp, int status, ExchangeContext ctx, String body, String preview) {
        JsonNode json = tryParse(body);
        String requestId = firstNonBlank(
                resp.headers().asHttpHeaders().getFirst(REQUEST_ID_HEADER),
                JsonValues.firstText(json, "request_id", "requestId", "trace_id").orElse(null),
                ctx.requestId());
        String hint = firstNonBlank(
                resp.headers().asHttpHeaders().getFirst(ERROR_CODE_HEADER),
                JsonValues.firstText(json, "hint", "error.code", "error_code", "code").orElse(null),
                status == 404 ? NOT_FOUND_HINT : null,
                JsonValues.firstText(json, "msg", "message", "error.message", "error").orElse(null));

        return new AnalysisHttpException(
                "Analysis request failed (" + status + ")",
                status, ctx.endpoint(), requestId, preview, hint, null);
    }

    private JsonNode parseJson(String text, ExchangeContext ctx, int status) {
        if (text == null || text.isBlank()) return MissingNode.getInstance();
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new AnalysisException(AnalysisErrorCode.INVALID_RESPONSE,
                    "Analysis response is not valid JSON",
                    new AnalysisErrorContext(ctx.endpoint(), status, ctx.requestId(), Texts.cut(text, BODY_PREVIEW_LIMIT), null),
                    ex);
        }
    }

    private JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) return MissingNode.getInstance();
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            log.debug("[AnalysisHttpClient] error body is not JSON: {}", ex.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    private Retry retrySpec(HttpMethod method, String endpoint) {
        return Retry.backoff(props.getMaxRetries(), props.getRetryBackoff())
                .jitter(0.5)
                .filter(ex -> ex instanceof AnalysisException && ((AnalysisException) ex).isTransient())
                .doBeforeRetry(signal -> log.warn("[AnalysisHttpClient] retry {}/{} {} {} after: {}",
                        signal.totalRetries() + 1, props.getMaxRetries(), method, endpoint,
                        signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private void applyHeaders(HttpHeaders h, RequestOptions opts, String requestId, boolean hasBody) {
        if (opts.includeAuthHeader() && !Texts.isBlank(props.getApiKey())) {
            h.setBearerAuth(props.getApiKey());
        }
        if (hasBody) {
            h.setContentType(MediaType.APPLICATION_JSON);
        }
        String organizationId = resolveOrganization(opts.organizationId());
        if (organizationId != null && opts.includeAuthHeader()) {
            h.set(ORGANIZATION_HEADER, organizationId);
        }
        h.set(REQUEST_ID_HEADER, requestId);
    }

    /** A non-blank per-call value wins over the configured default. */
    String resolveOrganization(String override) {
        String o = Texts.trimToNull(override);
        return o != null ? o : Texts.trimToNull(props.getOrganizationId());
    }

    String buildUrl(String pathOrUrl) {
        if (pathOrUrl != null && ABSOLUTE_URL.matcher(pathOrUrl).matches()) {
            return pathOrUrl;
        }
        String normalized = pathOrUrl == null ? "" : pathOrUrl.replaceAll("^/+", "");
        return normalized.isEmpty() ? baseUrl : baseUrl + "/" + normalized;
    }

    private Duration resolveTimeout(Duration requested) {
        Duration t = requested != null ? requested : props.getRequestTimeout();
        if (t == null || t.compareTo(MIN_TIMEOUT) < 0) return MIN_TIMEOUT;
        return t;
    }

    /**
     * Trailing slashes are dropped; legacy endpoint suffixes such as {@code /document/analyze}
     * are cut back to the API version root.
     */
    static String resolveBaseUrl(String candidate) {
        String url = Texts.isBlank(candidate) ? AnalysisProperties.DEFAULT_BASE_URL : candidate.trim();
        url = url.replaceAll("/+$", "");
        String lower = url.toLowerCase(Locale.ROOT);
        for (String suffix : new String[]{"/document/analyze", "/extract/task"}) {
            if (lower.endsWith(suffix)) {
                url = url.substring(0, url.length() - suffix.length());
                break;
            }
        }
        return url;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    @FunctionalInterface
    private interface BodyReader<T> {
        Mono<T> read(ClientResponse response, ExchangeContext ctx);
    }

    private record ExchangeContext(HttpMethod method, String endpoint, String requestId, long startNanos) {
        void log(int status, String bodyPreview) {
            if (!AnalysisHttpClient.log.isDebugEnabled()) return;
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            AnalysisHttpClient.log.debug("[AnalysisHttpClient] requestId={} {} {} status={} durationMs={} body={}",
                    requestId, method, endpoint, status, durationMs, bodyPreview);
        }
    }
}
