package com.astrolabe.service;

import com.astrolabe.model.AppConfig;
import com.astrolabe.model.SchemaEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads the fields resource into an ordered map of canonical key to {@link SchemaEntry}.
 * Every call returns a new map.
 */
public class SchemaTableLoader extends TableResourceLoader<LinkedHashMap<String, SchemaEntry>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaTableLoader.class);

    public static final List<String> DEFAULT_COLUMN_NAMES = Arrays.asList("obsCoreKey", "datatype", "required", "default");

    static final String COL_KEY = "obsCoreKey";
    static final String COL_DATATYPE = "datatype";
    static final String COL_REQUIRED = "required";
    static final String COL_DEFAULT = "default";

    public SchemaTableLoader() {
        this(AppConfig.getFieldsResource());
    }

    public SchemaTableLoader(String defaultResource) {
        super(defaultResource);
    }

    @Override
    protected LinkedHashMap<String, SchemaEntry> parse(List<String> lines, String sourceName) {
        List<String> columns = DEFAULT_COLUMN_NAMES;
        LinkedHashMap<String, SchemaEntry> fields = new LinkedHashMap<>();
        int skipped = 0;

        for (String line : lines) {
            List<String> flds = splitFields(line);
            if (line.startsWith(COLUMN_NAME_MARKER)) {
                if (flds.size() > 2) {              // marker plus at least two column names
                    columns = flds.subList(1, flds.size());
                }
                continue;
            }
            if (flds.size() != columns.size()) {
                LOGGER.debug("Ignoring malformed field line in {}: '{}'", sourceName, line);
                skipped++;
                continue;
            }
            SchemaEntry entry = toEntry(columns, flds);
            if (entry != null) fields.put(entry.getCanonicalKey(), entry);
        }

        LOGGER.info("Read {} field information records from {}", fields.size(), sourceName);
        if (skipped > 0) LOGGER.debug("Skipped {} malformed lines in {}", skipped, sourceName);
        return fields;
    }

    private SchemaEntry toEntry(List<String> columns, List<String> flds) {
        // the first column is the key whatever it is called
        String key = column(columns, flds, COL_KEY, 0);
        if (key == null || key.isEmpty()) return null;
        String datatype = column(columns, flds, COL_DATATYPE, 1);
        String required = column(columns, flds, COL_REQUIRED, 2);
        String def = column(columns, flds, COL_DEFAULT, 3);
        return new SchemaEntry(key, datatype, Boolean.parseBoolean(required), def);
    }

    private static String column(List<String> columns, List<String> flds, String name, int fallbackIdx) {
        int idx = columns.indexOf(name);
        if (idx < 0) idx = (fallbackIdx == 0) ? 0 : -1;
        return (idx >= 0 && idx < flds.size()) ? flds.get(idx) : null;
    }
}
