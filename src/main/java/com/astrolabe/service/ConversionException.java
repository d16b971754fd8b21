package com.astrolabe.service;

public class ConversionException extends CoercionException {
    public ConversionException(String value, String datatype, Throwable cause) {
        super("Unable to convert value '" + value + "' to '" + datatype + "'.", value, datatype, cause);
    }
}
