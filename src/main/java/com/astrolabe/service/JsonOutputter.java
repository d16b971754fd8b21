package com.astrolabe.service;

import com.astrolabe.model.FieldsInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

// JSON Lines: one object of valued fields per image, in schema order
public class JsonOutputter extends AbstractFileOutputter {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TypeCoercionService coercion;

    public JsonOutputter(File outputDir, TypeCoercionService coercion) {
        super(outputDir, "json");
        this.coercion = coercion;
    }

    @Override
    public void outputImageInfo(FieldsInfo fieldsInfo) {
        writeLines(toJson(fieldsInfo));
    }

    String toJson(FieldsInfo fieldsInfo) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : fieldsInfo.valued().entrySet()) {
            Object v = e.getValue();
            row.put(e.getKey(), (v instanceof LocalDateTime) ? coercion.format(v) : v);
        }
        try {
            return mapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new OutputException("Unable to serialize record for '" + row.get(FieldResolutionEngine.FILE_NAME) + "'", e);
        }
    }
}
