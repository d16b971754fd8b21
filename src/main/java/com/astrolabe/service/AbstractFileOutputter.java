package com.astrolabe.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes records to one file per run, named {@code ffp-<timestamp>.<format>} in the output directory.
 */
abstract class AbstractFileOutputter implements InformationOutputter {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractFileOutputter.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss-SSS");

    private final File outputFile;
    private final BufferedWriter writer;

    protected AbstractFileOutputter(File outputDir, String format) {
        this.outputFile = new File(outputDir, "ffp-" + LocalDateTime.now().format(STAMP) + "." + format);
        try {
            this.writer = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputException("Unable to create output file '" + outputFile.getAbsolutePath() + "'", e);
        }
        LOGGER.info("Writing {} output to {}", format, outputFile.getAbsolutePath());
    }

    protected synchronized void writeLines(String... lines) {
        try {
            for (String line : lines) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new OutputException("Unable to write to '" + outputFile.getAbsolutePath() + "'", e);
        }
    }

    @Override
    public File getOutputFile() {
        return outputFile;
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new OutputException("Unable to close '" + outputFile.getAbsolutePath() + "'", e);
        }
    }
}
