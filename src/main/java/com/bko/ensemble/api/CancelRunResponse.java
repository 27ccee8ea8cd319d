package com.bko.ensemble.api;

public record CancelRunResponse(
        String runId,
        String status,
        String message
) {
    public static CancelRunResponse success(String runId) {
        return new CancelRunResponse(runId, "success", "Run cancellation requested.");
    }

    public static CancelRunResponse notFound(String runId) {
        return new CancelRunResponse(runId, "not-found", "Run not found.");
    }
}
