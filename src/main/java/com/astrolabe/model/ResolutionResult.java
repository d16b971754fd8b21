package com.astrolabe.model;

/**
 * Outcome of resolving one file: either the filled field table or the reason the file
 * was abandoned.
 */
public class ResolutionResult {
    public enum Status { RESOLVED, ABORTED }

    public final Status status;
    public final FieldsInfo fieldsInfo; // null when aborted
    public final String reason;         // null when resolved

    private ResolutionResult(Status status, FieldsInfo fieldsInfo, String reason) {
        this.status = status;
        this.fieldsInfo = fieldsInfo;
        this.reason = reason;
    }

    public static ResolutionResult resolved(FieldsInfo fieldsInfo) {
        return new ResolutionResult(Status.RESOLVED, fieldsInfo, null);
    }

    public static ResolutionResult aborted(String reason) {
        return new ResolutionResult(Status.ABORTED, null, reason);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
