package com.example.OfferScan.model;

/**
 * Snapshot of one remote analysis job as reported by the submit or poll endpoint.
 */
public record AnalysisTask(
        String taskId,
        TaskState state,
        String resultArchiveUrl,
        String errorCode,
        String errorMessage
) {
    public boolean hasArchive() {
        return resultArchiveUrl != null && !resultArchiveUrl.isBlank();
    }

    public AnalysisTask withTaskIdIfAbsent(String fallbackTaskId) {
        if (taskId != null && !taskId.isBlank()) return this;
        return new AnalysisTask(fallbackTaskId, state, resultArchiveUrl, errorCode, errorMessage);
    }
}
