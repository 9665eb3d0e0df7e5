package com.example.OfferScan.exception;

public enum AnalysisErrorCode {
    HTTP_ERROR,
    TIMEOUT,
    INVALID_RESPONSE,
    INVALID_ARGUMENT,
    NO_TASK_ID,
    NO_RESULT_URL,
    TASK_FAILED,
    ARCHIVE_ERROR,
    EMPTY_ANALYSIS,
    CANCELLED,
    AI_EXTRACTION_FAILED
}
