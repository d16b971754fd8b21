package com.astrolabe.service;

/**
 * Thrown while resolving a file when the file cannot be processed at all, e.g. for a
 * coordinate projection we do not handle. Caught by the resolution engine and turned
 * into an aborted result.
 */
public class AbortFileProcessingException extends RuntimeException {
    public AbortFileProcessingException(String message) {
        super(message);
    }
}
