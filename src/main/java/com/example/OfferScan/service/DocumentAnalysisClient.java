package com.example.OfferScan.service;

import com.example.OfferScan.config.AnalysisProperties;
import com.example.OfferScan.exception.AnalysisErrorCode;
import com.example.OfferScan.exception.AnalysisErrorContext;
import com.example.OfferScan.exception.AnalysisException;
import com.example.OfferScan.model.AnalysisResult;
import com.example.OfferScan.model.AnalysisTask;
import com.example.OfferScan.model.AnalyzeRequest;
import com.example.OfferScan.model.TaskState;
import com.example.OfferScan.util.JsonValues;
import com.example.OfferScan.util.Texts;
import com.fasterxml.jackson.databind.JsonNode;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Task client of the remote document analysis service.
 * <p>
 * Submits a signed document URL, polls the task until it reaches a terminal state, downloads the
 * result archive and returns the normalized analysis.
 */
@Service
public class DocumentAnalysisClient {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalysisClient.class);

    static final String[] TASK_ID_PATHS = {
            "task_id", "taskId", "task.task_id", "task.id",
            "data.task_id", "data.taskId", "data.task.task_id", "data.task.id"
    };
    static final String[] ARCHIVE_URL_PATHS = {
            "full_zip_url", "result.full_zip_url", "data.full_zip_url", "data.result.full_zip_url",
            "result_url", "data.result_url", "zip_url", "archive_url"
    };
    static final String[] STATE_PATHS = {
            "state", "status", "task.state", "task.status",
            "data.state", "data.status", "data.task.state", "data.task.status"
    };
    private static final String[] ERROR_CODE_PATHS = {
            "error.code", "error_code", "data.error.code", "data.error_code", "data.err_code"
    };
    private static final String[] ERROR_MESSAGE_PATHS = {
            "error.message", "err_msg", "error_message", "data.error.message", "data.err_msg", "error", "message"
    };

    private static final Pattern TASK_ID_VALUE = Pattern.compile("[\\w-]+");
    private static final Pattern HTTP_URL = Pattern.compile("^https?://.+", Pattern.CASE_INSENSITIVE);

    private final AnalysisHttpClient http;
    private final ResultArchiveDecoder archiveDecoder;
    private final AnalysisPayloadNormalizer normalizer;
    private final AnalysisProperties props;

    public DocumentAnalysisClient(AnalysisHttpClient http,
                                  ResultArchiveDecoder archiveDecoder,
                                  AnalysisPayloadNormalizer normalizer,
                                  AnalysisProperties props) {
        this.http = http;
        this.archiveDecoder = archiveDecoder;
        this.normalizer = normalizer;
        this.props = props;
    }

    public Mono<AnalysisResult> analyze(AnalyzeRequest request) {
        return analyze(request, Mono.never());
    }

    /**
     * @param cancelSignal completing or emitting before the result is ready aborts submit, polling
     *                     and download with {@link AnalysisErrorCode#CANCELLED}
     */
    public Mono<AnalysisResult> analyze(AnalyzeRequest request, Publisher<?> cancelSignal) {
        return Mono.defer(() -> run(request))
                .takeUntilOther(cancelSignal)
                .switchIfEmpty(Mono.error(() -> new AnalysisException(
                        AnalysisErrorCode.CANCELLED, "Document analysis cancelled")));
    }

    private Mono<AnalysisResult> run(AnalyzeRequest request) {
        if (request == null || Texts.isBlank(request.signedUrl())
                || !HTTP_URL.matcher(request.signedUrl().trim()).matches()) {
            return Mono.error(new AnalysisException(AnalysisErrorCode.INVALID_ARGUMENT,
                    "A signed http(s) document URL is required"));
        }

        RequestOptions options = RequestOptions.forOrganization(request.organizationId());
        String organizationId = http.resolveOrganization(request.organizationId());

        return http.requestJson(HttpMethod.POST, props.getTaskPath(), buildSubmitBody(request, organizationId), options)
                .flatMap(submitted -> {
                    AnalysisTask task = readTask(submitted.data());
                    log.info("[DocumentAnalysisClient] submitted documentId={} taskId={} state={}",
                            request.documentId(), task.taskId(), task.state());

                    if (task.state() == TaskState.FAILED) {
                        return Mono.error(taskFailed(task, submitted.endpoint()));
                    }
                    if (task.hasArchive()) {
                        return Mono.just(task);
                    }
                    if (task.state() == TaskState.SUCCEEDED) {
                        return Mono.error(noResultUrl(task, submitted.endpoint()));
                    }
                    if (task.taskId() == null) {
                        return Mono.error(new AnalysisException(AnalysisErrorCode.NO_TASK_ID,
                                "Submit response carries no task id",
                                AnalysisErrorContext.ofEndpoint(submitted.endpoint(), submitted.requestId()),
                                null));
                    }
                    return pollUntilTerminal(task.taskId(), options);
                })
                .flatMap(task -> fetchResult(task, request));
    }

    static Map<String, Object> buildSubmitBody(AnalyzeRequest request, String organizationId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("document_url", request.signedUrl().trim());
        if (!Texts.isBlank(request.documentId())) body.put("document_id", request.documentId().trim());
        if (organizationId != null) body.put("organization_id", organizationId);
        return body;
    }

    private Mono<AnalysisTask> pollUntilTerminal(String taskId, RequestOptions options) {
        String path = props.getTaskPath().replaceAll("/+$", "") + "/"
                + URLEncoder.encode(taskId, StandardCharsets.UTF_8);
        int maxAttempts = props.getMaxPollAttempts();

        return Mono.defer(() -> http.requestJson(HttpMethod.GET, path, null, options))
                .map(resp -> new PolledTask(readTask(resp.data()).withTaskIdIfAbsent(taskId), resp.endpoint()))
                .doOnNext(p -> log.debug("[DocumentAnalysisClient] taskId={} state={}", taskId, p.task().state()))
                .delaySubscription(props.getPollInterval())
                .repeat()
                .take(maxAttempts)
                .filter(p -> p.task().state().isTerminal())
                .next()
                .switchIfEmpty(Mono.error(() -> new AnalysisException(AnalysisErrorCode.TIMEOUT,
                        "Task " + taskId + " not finished after " + maxAttempts + " polls",
                        new AnalysisErrorContext(http.buildUrl(path), 504, null, null, null),
                        null)))
                .timeout(props.getMaxPollDuration())
                .onErrorMap(TimeoutException.class, ex -> new AnalysisException(AnalysisErrorCode.TIMEOUT,
                        "Task " + taskId + " not finished within " + props.getMaxPollDuration(),
                        new AnalysisErrorContext(http.buildUrl(path), 504, null, null, null),
                        ex))
                .flatMap(p -> {
                    AnalysisTask task = p.task();
                    if (task.state() == TaskState.FAILED) return Mono.error(taskFailed(task, p.endpoint()));
                    if (!task.hasArchive()) return Mono.error(noResultUrl(task, p.endpoint()));
                    return Mono.just(task);
                });
    }

    private Mono<AnalysisResult> fetchResult(AnalysisTask task, AnalyzeRequest request) {
        return http.requestBytes(task.resultArchiveUrl(), RequestOptions.download())
                .publishOn(Schedulers.boundedElastic())
                .map(resp -> {
                    JsonNode payload = archiveDecoder.decode(resp.data());
                    AnalysisResult result = normalizer.normalize(payload).withTaskId(task.taskId());
                    log.info("[DocumentAnalysisClient] analysis ready documentId={} taskId={} pages={} textChars={}",
                            request.documentId(), task.taskId(), result.pages().size(), result.text().length());
                    return result;
                });
    }

    static AnalysisTask readTask(JsonNode json) {
        return new AnalysisTask(
                extractTaskId(json).orElse(null),
                TaskState.from(JsonValues.firstText(json, STATE_PATHS).orElse(null)),
                JsonValues.firstText(json, ARCHIVE_URL_PATHS).orElse(null),
                JsonValues.firstText(json, ERROR_CODE_PATHS).orElse(null),
                JsonValues.firstText(json, ERROR_MESSAGE_PATHS).orElse(null));
    }

    /**
     * Known locations first, then a breadth-first scan for any field whose name mentions both
     * "task" and "id" and whose value looks like an identifier.
     */
    static Optional<String> extractTaskId(JsonNode json) {
        if (json == null || json.isMissingNode()) return Optional.empty();

        for (String path : TASK_ID_PATHS) {
            Optional<String> v = JsonValues.text(JsonValues.at(json, path)).filter(DocumentAnalysisClient::isTaskIdValue);
            if (v.isPresent()) return v;
        }

        Deque<JsonNode> queue = new ArrayDeque<>();
        queue.add(json);
        while (!queue.isEmpty()) {
            JsonNode node = queue.poll();
            if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> f = fields.next();
                    String key = f.getKey().toLowerCase(Locale.ROOT);
                    if (key.contains("task") && key.contains("id")) {
                        Optional<String> v = JsonValues.text(f.getValue()).filter(DocumentAnalysisClient::isTaskIdValue);
                        if (v.isPresent()) return v;
                    }
                    if (f.getValue().isContainerNode()) queue.add(f.getValue());
                }
            } else if (node.isArray()) {
                node.forEach(queue::add);
            }
        }
        return Optional.empty();
    }

    private static boolean isTaskIdValue(String v) {
        return TASK_ID_VALUE.matcher(v).matches();
    }

    private static AnalysisException taskFailed(AnalysisTask task, String endpoint) {
        String reason = task.errorMessage() != null ? task.errorMessage() : "no reason given";
        return new AnalysisException(AnalysisErrorCode.TASK_FAILED,
                "Analysis task " + task.taskId() + " failed: " + reason,
                new AnalysisErrorContext(endpoint, 0, null, null, task.errorCode()),
                null);
    }

    private static AnalysisException noResultUrl(AnalysisTask task, String endpoint) {
        return new AnalysisException(AnalysisErrorCode.NO_RESULT_URL,
                "Analysis task " + task.taskId() + " finished without a result archive URL",
                AnalysisErrorContext.ofEndpoint(endpoint, null),
                null);
    }

    private record PolledTask(AnalysisTask task, String endpoint) {
    }
}
