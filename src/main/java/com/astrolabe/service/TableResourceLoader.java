package com.astrolabe.service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared reading of the comma separated resource files (fields and aliases).
 * Blank lines and comment lines are dropped here; subclasses interpret the rest.
 */
abstract class TableResourceLoader<T> {

    /** String which defines a comment line in the resource files. */
    static final String COMMENT_MARKER = "#";

    /** String which starts the line re-declaring the column names. */
    static final String COLUMN_NAME_MARKER = "_COLUMN_NAMES_";

    /** String which starts a "not yet implemented" line. */
    static final String NOP_ENTRY_KEY = "_NOP_";

    private final String defaultResource;

    protected TableResourceLoader(String defaultResource) {
        this.defaultResource = defaultResource;
    }

    /** Loads from the given file, or from the default classpath resource when the file is null. */
    public T load(File file) {
        if (file == null) return loadResource(defaultResource);
        try (Reader r = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return load(r, file.getAbsolutePath());
        } catch (IOException e) {
            throw new SchemaLoadException("Unable to read '" + file.getAbsolutePath() + "'", e);
        }
    }

    public T loadResource(String resourcePath) {
        InputStream in = getClass().getResourceAsStream(resourcePath);
        if (in == null) throw new SchemaLoadException("Resource not found: " + resourcePath, null);
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(r, resourcePath);
        } catch (IOException e) {
            throw new SchemaLoadException("Unable to read resource '" + resourcePath + "'", e);
        }
    }

    public T load(Reader reader, String sourceName) {
        List<String> lines = new ArrayList<>();
        try {
            BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
            String line;
            while ((line = br.readLine()) != null) {
                if (line.trim().isEmpty() || line.startsWith(COMMENT_MARKER)) continue;
                lines.add(line);
            }
        } catch (IOException e) {
            throw new SchemaLoadException("Unable to read '" + sourceName + "'", e);
        }
        return parse(lines, sourceName);
    }

    protected abstract T parse(List<String> lines, String sourceName);

    // trailing empty fields are dropped, so "a, b," has two fields
    static List<String> splitFields(String line) {
        List<String> out = new ArrayList<>();
        for (String f : line.split(",")) out.add(f.trim());
        return out;
    }
}
