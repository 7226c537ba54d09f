package com.osa.aggregator.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.osa.aggregator.backend.BackendException;
import com.osa.aggregator.backend.ResultItem;
import java.util.List;

/**
 * What happened to one selected backend during a dispatch. When a fallback
 * served the request, {@code servedBy} names it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendOutcome {
    @JsonProperty("backend_id")
    private final String backendId;

    @JsonProperty("served_by")
    private final String servedBy;

    private final OutcomeStatus status;

    @JsonProperty("result_count")
    private final int resultCount;

    private final int attempts;

    @JsonProperty("took_ms")
    private final long tookMs;

    @JsonProperty("error_kind")
    private final String errorKind;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonIgnore
    private final List<ResultItem> items;

    private BackendOutcome(
        String backendId,
        String servedBy,
        OutcomeStatus status,
        List<ResultItem> items,
        int attempts,
        long tookMs,
        String errorKind,
        String errorMessage
    ) {
        this.backendId = backendId;
        this.servedBy = servedBy;
        this.status = status;
        this.items = items == null ? List.of() : List.copyOf(items);
        this.resultCount = this.items.size();
        this.attempts = attempts;
        this.tookMs = tookMs;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static BackendOutcome ok(String backendId, List<ResultItem> items, int attempts, long tookMs) {
        return new BackendOutcome(backendId, null, OutcomeStatus.OK, items, attempts, tookMs, null, null);
    }

    public static BackendOutcome failed(String backendId, Throwable error, int attempts, long tookMs) {
        String kind = error instanceof BackendException
            ? ((BackendException) error).getKind().name().toLowerCase()
            : error == null ? null : error.getClass().getSimpleName();
        return new BackendOutcome(
            backendId,
            null,
            OutcomeStatus.FAILED,
            null,
            attempts,
            tookMs,
            kind,
            error == null ? null : error.getMessage()
        );
    }

    public static BackendOutcome skipped(String backendId, String reason) {
        return new BackendOutcome(backendId, null, OutcomeStatus.SKIPPED, null, 0, 0L, reason, null);
    }

    public static BackendOutcome timedOut(String backendId, long tookMs) {
        return new BackendOutcome(backendId, null, OutcomeStatus.TIMED_OUT, null, 0, tookMs, "deadline", null);
    }

    public static BackendOutcome cancelled(String backendId) {
        return new BackendOutcome(backendId, null, OutcomeStatus.CANCELLED, null, 0, 0L, null, null);
    }

    /**
     * Re-labels a fallback's outcome under the backend it stood in for.
     */
    public BackendOutcome servedFor(String originalBackendId, int originalAttempts, long totalTookMs) {
        return new BackendOutcome(
            originalBackendId,
            backendId,
            status,
            items,
            originalAttempts + attempts,
            totalTookMs,
            errorKind,
            errorMessage
        );
    }

    public String getBackendId() {
        return backendId;
    }

    public String getServedBy() {
        return servedBy;
    }

    /**
     * The backend whose results these are.
     */
    @JsonIgnore
    public String getEffectiveBackendId() {
        return servedBy != null ? servedBy : backendId;
    }

    public OutcomeStatus getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == OutcomeStatus.OK;
    }

    public int getResultCount() {
        return resultCount;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<ResultItem> getItems() {
        return items;
    }
}
