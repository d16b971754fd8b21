package com.astrolabe.service;

import com.astrolabe.model.AliasTable;
import com.astrolabe.model.FieldRecord;
import com.astrolabe.model.FieldsInfo;
import com.astrolabe.model.HeaderFields;
import com.astrolabe.model.ResolutionResult;
import com.astrolabe.model.SchemaEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the ObsCore fields of one file from its header. Stages run in order and none
 * of them replaces a value an earlier stage has set:
 * file identity, header aliasing, type coercion, defaults, computed fields, required audit.
 * <p>
 * The schema and alias table are read-only, so one engine may serve several threads.
 */
public class FieldResolutionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FieldResolutionEngine.class);

    public static final String FILE_NAME = "file_name";
    public static final String FILE_PATH = "file_path";
    public static final String FILE_SIZE = "access_estsize";   // estimated size is the size of the file

    private final Map<String, SchemaEntry> schema;
    private final AliasTable aliases;
    private final TypeCoercionService coercion;
    private final GeometryService geometry;
    private final Map<String, ComputeRule> rules;

    public FieldResolutionEngine(Map<String, SchemaEntry> schema, AliasTable aliases) {
        this(schema, aliases, new TypeCoercionService(), ComputeRules.defaultRules());
    }

    public FieldResolutionEngine(Map<String, SchemaEntry> schema, AliasTable aliases,
                                 TypeCoercionService coercion, Map<String, ComputeRule> rules) {
        this.schema = Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        this.aliases = aliases;
        this.coercion = coercion;
        this.geometry = new GeometryService(coercion);
        this.rules = rules;
    }

    /** Runs all stages on a fresh field table for the given file and header. */
    public ResolutionResult resolve(Path file, HeaderFields header) {
        FieldsInfo fieldsInfo = FieldsInfo.fromSchema(schema);
        try {
            addFileInformation(file, fieldsInfo);
            addInfoFromHeader(header, fieldsInfo);
            convertHeaderValues(fieldsInfo);
            addDefaultValues(fieldsInfo);
            computeValues(new ResolutionContext(file, header, fieldsInfo, geometry));
            ensureRequiredFields(fieldsInfo);
        } catch (AbortFileProcessingException afpx) {
            return ResolutionResult.aborted(afpx.getMessage());
        }
        if (LOGGER.isDebugEnabled()) {
            fieldsInfo.records().forEach(rec -> LOGGER.debug("{}", rec));
        }
        return ResolutionResult.resolved(fieldsInfo);
    }

    // --- STAGE 1: FILE IDENTITY ---
    void addFileInformation(Path file, FieldsInfo fieldsInfo) {
        if (file == null) return;
        fieldsInfo.setValueIfAbsent(FILE_NAME, file.getFileName().toString());
        fieldsInfo.setValueIfAbsent(FILE_PATH, file.toAbsolutePath().toString());
        if (fieldsInfo.contains(FILE_SIZE)) {
            try {
                fieldsInfo.setValueIfAbsent(FILE_SIZE, Files.size(file));
            } catch (IOException e) {
                LOGGER.warn("Unable to read size of '{}': {}", file, e.getMessage());
            }
        }
    }

    // --- STAGE 2: HEADER ALIASING ---
    void addInfoFromHeader(HeaderFields header, FieldsInfo fieldsInfo) {
        for (Map.Entry<String, String> card : header.asMap().entrySet()) {
            String obsCoreKey = aliases.canonicalKeyFor(card.getKey());
            if (obsCoreKey == null) continue;
            FieldRecord rec = fieldsInfo.get(obsCoreKey);
            if (rec != null) rec.attachHeader(card.getKey(), card.getValue());
        }
    }

    // --- STAGE 3: TYPE COERCION ---
    void convertHeaderValues(FieldsInfo fieldsInfo) {
        for (FieldRecord rec : fieldsInfo.records()) {
            if (rec.hasValue() || !rec.hasSourceValue()) continue;
            try {
                rec.setValueIfAbsent(coercion.coerce(rec.getSourceValueString(), rec.getEntry().getDatatypeTag()));
            } catch (UnknownDatatypeException e) {
                LOGGER.warn("Unknown datatype '{}' for field '{}'. Ignoring bad field value.",
                        e.getDatatype(), rec.getSourceHeaderKey());
            } catch (ConversionException e) {
                LOGGER.warn("Unable to convert value '{}' for field '{}' to '{}'. Ignoring bad field value.",
                        e.getValue(), rec.getSourceHeaderKey(), e.getDatatype());
            }
        }
    }

    // --- STAGE 4: DEFAULTS ---
    void addDefaultValues(FieldsInfo fieldsInfo) {
        for (FieldRecord rec : fieldsInfo.records()) {
            SchemaEntry entry = rec.getEntry();
            if (rec.hasValue() || !entry.hasDefault()) continue;
            try {
                rec.setValueIfAbsent(coercion.coerce(entry.getDefaultLiteral(), entry.getDatatypeTag()));
            } catch (UnknownDatatypeException e) {
                LOGGER.warn("Unknown datatype '{}' for field '{}'. Field value not set.", e.getDatatype(), rec.getKey());
            } catch (ConversionException e) {
                LOGGER.warn("Unable to convert default value '{}' for field '{}' to '{}'. Field value not set.",
                        e.getValue(), rec.getKey(), e.getDatatype());
            }
        }
    }

    // --- STAGE 5: COMPUTED FIELDS ---
    void computeValues(ResolutionContext ctx) {
        for (FieldRecord rec : ctx.getFieldsInfo().records()) {
            if (rec.hasValue()) continue;
            ComputeRule rule = rules.get(rec.getKey());
            if (rule == null) continue;
            Optional<?> value = rule.compute(ctx);
            value.ifPresent(rec::setValueIfAbsent);
        }
    }

    // --- STAGE 6: REQUIRED AUDIT ---
    void ensureRequiredFields(FieldsInfo fieldsInfo) {
        for (FieldRecord rec : fieldsInfo.records()) {
            if (rec.hasValue()) continue;
            if (rec.getEntry().isRequired()) {
                LOGGER.warn("Required field '{}' still does not have a value.", rec.getKey());
            } else {
                LOGGER.debug("Optional field '{}' still does not have a value.", rec.getKey());
            }
        }
    }

    public Map<String, SchemaEntry> getSchema() {
        return schema;
    }
}
