package com.astrolabe.service;

import com.astrolabe.model.FieldsInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FitsFileProcessorServiceTest {

    @TempDir
    Path dir;

    private RecordingOutputter outputter;
    private FitsFileProcessorService processor;

    @BeforeEach
    public void setUp() throws Exception {
        Path sub = Files.createDirectories(dir.resolve("deep"));
        FitsFixtures.writeImage(dir.resolve("goods_s_f090w.fits").toFile(), "RA---TAN");
        FitsFixtures.writeImage(sub.resolve("goods_n_f444w.fits").toFile(), "RA---TAN");
        FitsFixtures.writeImage(sub.resolve("hudf_sin.fits").toFile(), "RA---SIN");
        Files.write(dir.resolve("broken.fits"), "garbage".getBytes(StandardCharsets.US_ASCII));
        Files.write(dir.resolve("notes.txt"), "not an image".getBytes(StandardCharsets.US_ASCII));

        FieldResolutionEngine engine = new FieldResolutionEngine(
                new SchemaTableLoader().load((File) null), new AliasTableLoader().load((File) null));
        outputter = new RecordingOutputter();
        processor = new FitsFileProcessorService(new FitsHeaderService(), engine, outputter);
    }

    private Set<Object> outputNames() {
        Set<Object> names = new TreeSet<>();
        for (FieldsInfo info : outputter.records) names.add(info.getValueFor("file_name"));
        return names;
    }

    @Test public void directoryIsSearchedRecursively() {
        int count = processor.processPaths(Collections.singletonList(dir.toFile()));
        assertEquals(2, count);
        assertEquals(new TreeSet<>(Arrays.asList("goods_n_f444w.fits", "goods_s_f090w.fits")), outputNames());
    }

    @Test public void workerPoolGivesTheSameResult() {
        int count = processor.processPaths(Collections.singletonList(dir.toFile()), 3);
        assertEquals(2, count);
        assertEquals(2, outputter.records.size());
        assertEquals(new TreeSet<>(Arrays.asList("goods_n_f444w.fits", "goods_s_f090w.fits")), outputNames());
    }

    @Test public void explicitFilesAreProcessedWhateverTheirName() throws Exception {
        Path renamed = dir.resolve("image.dat");
        Files.copy(dir.resolve("goods_s_f090w.fits"), renamed);
        assertEquals(1, processor.processPaths(Collections.singletonList(renamed.toFile())));
    }

    @Test public void unreadablePathsAreSkipped() {
        List<File> paths = Arrays.asList(dir.resolve("missing").toFile(), dir.resolve("goods_s_f090w.fits").toFile());
        assertEquals(1, processor.processPaths(paths));
    }

    @Test public void abortedAndCorruptFilesAreNotCounted() {
        assertEquals(0, processor.processAFile(dir.resolve("deep").resolve("hudf_sin.fits").toFile()));
        assertEquals(0, processor.processAFile(dir.resolve("broken.fits").toFile()));
        assertTrue(outputter.records.isEmpty());
    }

    @Test public void listingFiltersOnFileType() {
        List<File> files = processor.listFitsFiles(dir.toFile());
        assertEquals(4, files.size());
        for (File f : files) assertTrue(f.getName().endsWith(".fits"), f.getName());
    }

    @Test public void acceptableFilenames() {
        assertTrue(processor.isAcceptableFilename("a.fits"));
        assertTrue(processor.isAcceptableFilename("a.fits.gz"));
        assertFalse(processor.isAcceptableFilename("a.fit"));
        assertFalse(processor.isAcceptableFilename("a.fits.txt"));

        FitsFileProcessorService fz = new FitsFileProcessorService(new FitsHeaderService(), null, outputter,
                Collections.singletonList(".fz"));
        assertTrue(fz.isAcceptableFilename("a.fz"));
        assertFalse(fz.isAcceptableFilename("a.fits"));
    }
}
