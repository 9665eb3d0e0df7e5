package com.example.OfferScan.exception;

import java.util.Objects;

/**
 * Base failure of the offer analysis pipeline. Every error raised by the task client,
 * the archive decoder and the AI extraction pass is (or extends) this type.
 */
public class AnalysisException extends RuntimeException {

    private final AnalysisErrorCode code;
    private final AnalysisErrorContext context;

    public AnalysisException(AnalysisErrorCode code, String message) {
        this(code, message, AnalysisErrorContext.empty(), null);
    }

    public AnalysisException(AnalysisErrorCode code, String message, Throwable cause) {
        this(code, message, AnalysisErrorContext.empty(), cause);
    }

    public AnalysisException(AnalysisErrorCode code, String message, AnalysisErrorContext context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.context = context == null ? AnalysisErrorContext.empty() : context;
    }

    public AnalysisErrorCode getCode() {
        return code;
    }

    public AnalysisErrorContext getContext() {
        return context;
    }

    public String getHint() {
        return context.hint();
    }

    /** Timeouts, 5xx and connection failures may succeed on a later attempt; 4xx never does. */
    public boolean isTransient() {
        if (code == AnalysisErrorCode.TIMEOUT) return true;
        if (code != AnalysisErrorCode.HTTP_ERROR) return false;
        int status = context.status();
        return status == 0 || status >= 500;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "] " + getMessage();
    }
}
