package com.astrolabe.service;

import com.astrolabe.model.FieldsInfo;
import java.io.Closeable;
import java.io.File;

/**
 * Receives resolved records and persists them. Implementations must accept calls from
 * several worker threads.
 */
public interface InformationOutputter extends Closeable {

    /** Output the given field information using the current output settings. */
    void outputImageInfo(FieldsInfo fieldsInfo);

    /** The file being written, if any. */
    File getOutputFile();

    @Override
    void close();
}
