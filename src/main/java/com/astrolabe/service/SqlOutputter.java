package com.astrolabe.service;

import com.astrolabe.model.FieldsInfo;
import java.io.File;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Writes one SQL insert statement per image, preceded by a comment naming the file.
 */
public class SqlOutputter extends AbstractFileOutputter {

    /** String which defines a comment line in the SQL output. */
    private static final String SQL_COMMENT = "--";

    private final String tableName;
    private final TypeCoercionService coercion;

    public SqlOutputter(File outputDir, String tableName, TypeCoercionService coercion) {
        super(outputDir, "sql");
        this.tableName = tableName;
        this.coercion = coercion;
    }

    @Override
    public void outputImageInfo(FieldsInfo fieldsInfo) {
        writeLines(makeFileInfo(fieldsInfo), toSql(fieldsInfo));
    }

    String makeFileInfo(FieldsInfo fieldsInfo) {
        StringBuilder buf = new StringBuilder(SQL_COMMENT);
        for (String key : new String[] {FieldResolutionEngine.FILE_NAME, FieldResolutionEngine.FILE_SIZE,
                FieldResolutionEngine.FILE_PATH}) {
            Object v = fieldsInfo.getValueFor(key);
            if (v != null) buf.append(' ').append(v);
        }
        return buf.toString();
    }

    String toSql(FieldsInfo fieldsInfo) {
        StringJoiner keys = new StringJoiner(", ");
        StringJoiner values = new StringJoiner(", ");
        for (Map.Entry<String, Object> e : fieldsInfo.valued().entrySet()) {
            keys.add(e.getKey());
            values.add(literal(e.getValue()));
        }
        return "insert into " + tableName + " (" + keys + ") values (" + values + ");";
    }

    private String literal(Object value) {
        String s = coercion.format(value);
        if (value instanceof String || value instanceof LocalDateTime) {
            return "'" + s.replace("'", "''") + "'";
        }
        return s;
    }
}
