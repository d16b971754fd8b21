package com.astrolabe.model;

import java.io.File;

/**
 * Settings for one run, collected from the command line with {@link AppConfig} defaults.
 * A null aliases or fields file means the bundled resource is used.
 */
public class ExtractorSettings {
    public final File aliasFile;
    public final File fieldsFile;
    public final String outputFormat;
    public final File outputDir;
    public final String imageTableName;
    public final int headerHdu;
    public final int threads;

    public ExtractorSettings(File aliasFile, File fieldsFile, String outputFormat, File outputDir,
                             String imageTableName, int headerHdu, int threads) {
        this.aliasFile = aliasFile;
        this.fieldsFile = fieldsFile;
        this.outputFormat = outputFormat;
        this.outputDir = outputDir;
        this.imageTableName = imageTableName;
        this.headerHdu = headerHdu;
        this.threads = Math.max(1, threads);
    }

    /** Settings taken entirely from {@link AppConfig}. */
    public static ExtractorSettings defaults() {
        return new ExtractorSettings(null, null, AppConfig.getOutputFormat(), new File(AppConfig.getOutputDir()),
                AppConfig.getImageTableName(), AppConfig.getHeaderHdu(), 1);
    }
}
