package com.example.OfferScan.exception;

/**
 * Non-2xx response (or a request that never got one) from the remote analysis service.
 */
public class AnalysisHttpException extends AnalysisException {

    public AnalysisHttpException(String message, int status, String endpoint, String requestId,
                                 String responseBody, String hint, Throwable cause) {
        this(status == 504 ? AnalysisErrorCode.TIMEOUT : AnalysisErrorCode.HTTP_ERROR,
                message, status, endpoint, requestId, responseBody, hint, cause);
    }

    public AnalysisHttpException(AnalysisErrorCode code, String message, int status, String endpoint,
                                 String requestId, String responseBody, String hint, Throwable cause) {
        super(code, message, new AnalysisErrorContext(endpoint, status, requestId, responseBody, hint), cause);
    }

    public int getStatus() {
        return getContext().status();
    }

    public String getEndpoint() {
        return getContext().endpoint();
    }

    public String getRequestId() {
        return getContext().requestId();
    }
}
