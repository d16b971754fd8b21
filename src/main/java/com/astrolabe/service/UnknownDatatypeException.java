package com.astrolabe.service;

public class UnknownDatatypeException extends CoercionException {
    public UnknownDatatypeException(String value, String datatype) {
        super("Unknown datatype '" + datatype + "' specified for conversion.", value, datatype, null);
    }
}
