package com.example.OfferScan.model;

import java.util.Locale;

/**
 * Remote task lifecycle. Backend versions use different words for the same state,
 * {@link #from(String)} folds them onto this vocabulary.
 */
public enum TaskState {
    PENDING,
    QUEUED,
    PROCESSING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /** Unknown or missing values count as {@link #PENDING} so the caller keeps polling. */
    public static TaskState from(String raw) {
        if (raw == null || raw.isBlank()) return PENDING;
        String s = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (s) {
            case "succeeded": case "success": case "successful": case "done":
            case "completed": case "complete": case "finished":
                return SUCCEEDED;
            case "failed": case "failure": case "error": case "errored":
            case "cancelled": case "canceled":
                return FAILED;
            case "queued": case "waiting": case "waiting_file":
                return QUEUED;
            case "processing": case "running": case "converting": case "in_progress": case "started":
                return PROCESSING;
            default:
                return PENDING;
        }
    }
}
