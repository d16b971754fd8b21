package com.astrolabe.service;

// Fields or aliases source missing or unreadable
public class SchemaLoadException extends RuntimeException {
    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
