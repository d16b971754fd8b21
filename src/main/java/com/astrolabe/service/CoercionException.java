package com.astrolabe.service;

/**
 * Raised when a header or default value string cannot be turned into a typed value.
 */
public class CoercionException extends RuntimeException {
    private final String value;
    private final String datatype;

    public CoercionException(String message, String value, String datatype, Throwable cause) {
        super(message, cause);
        this.value = value;
        this.datatype = datatype;
    }

    public String getValue() { return value; }

    public String getDatatype() { return datatype; }
}
