package com.astrolabe.service;

import com.astrolabe.model.AppConfig;
import com.astrolabe.model.HeaderFields;
import com.astrolabe.model.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives the extraction for a run: finds FITS files, reads each header, resolves the
 * fields and hands resolved records to the outputter. Returns how many files were
 * processed; skipped and aborted files are not counted.
 */
public class FitsFileProcessorService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FitsFileProcessorService.class);

    private final FitsHeaderService headerService;
    private final FieldResolutionEngine engine;
    private final InformationOutputter outputter;
    private final List<String> fileTypes;

    public FitsFileProcessorService(FitsHeaderService headerService, FieldResolutionEngine engine,
                                    InformationOutputter outputter) {
        this(headerService, engine, outputter, AppConfig.getFileTypes());
    }

    public FitsFileProcessorService(FitsHeaderService headerService, FieldResolutionEngine engine,
                                    InformationOutputter outputter, List<String> fileTypes) {
        this.headerService = headerService;
        this.engine = engine;
        this.outputter = outputter;
        this.fileTypes = fileTypes;
    }

    /** Process the single given file; returns 1 if a record was output, else 0. */
    public int processAFile(File aFile) {
        Optional<HeaderFields> header = headerService.readHeader(aFile);
        if (!header.isPresent()) return 0;              // unreadable: already logged

        LOGGER.info("Processing FITS file '{}'", aFile.getAbsolutePath());
        ResolutionResult result = engine.resolve(aFile.toPath(), header.get());
        if (!result.isResolved()) {
            LOGGER.error("Failed to process file '{}'. Error message was: {}", aFile.getAbsolutePath(), result.reason);
            return 0;
        }
        outputter.outputImageInfo(result.fieldsInfo);
        return 1;
    }

    /** Process the given files and directories one file at a time. */
    public int processPaths(List<File> paths) {
        int cnt = 0;
        for (File f : collectFiles(paths)) {
            cnt += processAFile(f);
        }
        return cnt;
    }

    /**
     * Process the given files and directories on a pool of worker threads. Each file is
     * resolved entirely by one worker.
     */
    public int processPaths(List<File> paths, int threads) {
        if (threads <= 1) return processPaths(paths);

        List<File> files = collectFiles(paths);
        ExecutorService exec = Executors.newFixedThreadPool(threads);
        AtomicInteger processed = new AtomicInteger(0);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (File f : files) {
                futures.add(exec.submit(() -> processed.addAndGet(processAFile(f))));
            }
            for (Future<?> fut : futures) {
                fut.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted after processing {} files", processed.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException(cause);
        } finally {
            exec.shutdownNow();
        }
        return processed.get();
    }

    /** Acceptable files among the given paths, with directories searched recursively. */
    public List<File> collectFiles(List<File> paths) {
        List<File> out = new ArrayList<>();
        for (File path : paths) {
            if (path.isDirectory()) {
                LOGGER.info("Processing FITS files in '{}'", path);
                out.addAll(listFitsFiles(path));
            } else if (path.isFile() && path.canRead()) {
                out.add(path);
            } else {
                LOGGER.warn("Skipping '{}': neither a readable file nor a directory", path);
            }
        }
        return out;
    }

    public List<File> listFitsFiles(File dir) {
        try (Stream<Path> walk = Files.walk(dir.toPath())) {
            return walk.filter(Files::isRegularFile)
                    .filter(Files::isReadable)
                    .filter(p -> isAcceptableFilename(p.getFileName().toString()))
                    .sorted()
                    .map(Path::toFile)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list '" + dir + "'", e);
        }
    }

    /** Tell whether the given filename is to be processed or not. */
    public boolean isAcceptableFilename(String filename) {
        for (String type : fileTypes) {
            if (filename.endsWith(type)) return true;
        }
        return false;
    }
}
