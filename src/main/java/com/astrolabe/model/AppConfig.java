package com.astrolabe.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public class AppConfig {
    private static final String RESOURCE = "/astrolabe.properties";
    private static final Properties props = load();

    private static final String KEY_ALIASES = "ffp.aliases.resource";
    private static final String KEY_FIELDS = "ffp.fields.resource";
    private static final String KEY_FORMAT = "ffp.output.format";
    private static final String KEY_OUTDIR = "ffp.output.dir";
    private static final String KEY_TABLE = "ffp.image.table";
    private static final String KEY_HDU = "ffp.header.hdu";
    private static final String KEY_FILE_TYPES = "ffp.file.types";

    private AppConfig() {
    }

    // System properties win over the bundled defaults
    private static String get(String key, String def) {
        String v = System.getProperty(key);
        if (v != null && !v.trim().isEmpty()) return v.trim();
        return props.getProperty(key, def).trim();
    }

    public static String getAliasesResource() { return get(KEY_ALIASES, "/jwst-aliases.txt"); }

    public static String getFieldsResource() { return get(KEY_FIELDS, "/jwst-fields.txt"); }

    public static String getOutputFormat() { return get(KEY_FORMAT, "sql"); }

    public static String getOutputDir() { return get(KEY_OUTDIR, "out"); }

    public static String getImageTableName() { return get(KEY_TABLE, "sia.jwst"); }

    public static int getHeaderHdu() {
        try {
            return Integer.parseInt(get(KEY_HDU, "0"));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static List<String> getFileTypes() {
        List<String> types = new ArrayList<>();
        for (String t : get(KEY_FILE_TYPES, ".fits,.fits.gz").split(",")) {
            if (!t.trim().isEmpty()) types.add(t.trim());
        }
        return types;
    }

    private static Properties load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
        return p;
    }
}
