package com.astrolabe.main;

import com.astrolabe.model.ExtractorSettings;
import com.astrolabe.service.FitsFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FitsFileProcessorAppTest {

    @TempDir
    Path dir;

    private final FitsFileProcessorApp app = new FitsFileProcessorApp();

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(FitsFileProcessorApp.buildOptions(), args);
    }

    @Test public void helpAndNoArgumentsExitCleanly() {
        assertEquals(0, app.run(new String[] {"-h"}));
        assertEquals(0, app.run(new String[0]));
    }

    @Test public void unknownOptionIsAUsageError() {
        assertEquals(1, app.run(new String[] {"-z", "x.fits"}));
    }

    @Test public void badOutputFormat() {
        assertEquals(FitsFileProcessorApp.EXIT_BAD_FORMAT, app.run(new String[] {"-f", "csv", "x.fits"}));
    }

    @Test public void badProcessorType() {
        assertEquals(FitsFileProcessorApp.EXIT_BAD_PROCESSOR, app.run(new String[] {"-t", "hst", "x.fits"}));
    }

    @Test public void unreadableAliasesFile() {
        String missing = dir.resolve("aliases.txt").toString();
        assertEquals(FitsFileProcessorApp.EXIT_BAD_ALIASES, app.run(new String[] {"-a", missing, "x.fits"}));
    }

    @Test public void unreadableFieldsFile() {
        String missing = dir.resolve("fields.txt").toString();
        assertEquals(FitsFileProcessorApp.EXIT_BAD_FIELDS, app.run(new String[] {"-i", missing, "x.fits"}));
    }

    @Test public void outputDirectoryMustExist() {
        String missing = dir.resolve("nowhere").toString();
        assertEquals(FitsFileProcessorApp.EXIT_BAD_OUTDIR, app.run(new String[] {"-o", missing, "x.fits"}));
    }

    @Test public void settingsFromCommandLine() throws Exception {
        Path aliases = Files.write(dir.resolve("aliases.txt"), "FILTER, filter\n".getBytes(StandardCharsets.UTF_8));
        ExtractorSettings s = FitsFileProcessorApp.toSettings(
                parse("-f", "JSON", "-o", dir.toString(), "-a", aliases.toString(), "-n", "4", "x.fits"));
        assertEquals("json", s.outputFormat);
        assertEquals(dir.toFile(), s.outputDir);
        assertEquals(aliases.toFile(), s.aliasFile);
        assertNull(s.fieldsFile);
        assertEquals(4, s.threads);
    }

    @Test public void threadCountMustBeANumber() {
        FitsFileProcessorApp.UsageException e = assertThrows(FitsFileProcessorApp.UsageException.class,
                () -> FitsFileProcessorApp.toSettings(parse("-o", dir.toString(), "-n", "many", "x.fits")));
        assertEquals(1, e.exitCode);
    }

    @Test public void jsonRunWritesOneRecordPerImage() throws Exception {
        Path in = Files.createDirectories(dir.resolve("in"));
        Path out = Files.createDirectories(dir.resolve("out"));
        FitsFixtures.writeImage(in.resolve("goods_s_f090w.fits").toFile(), "RA---TAN");
        FitsFixtures.writeImage(in.resolve("goods_n_f444w.fits").toFile(), "RA---TAN");

        assertEquals(0, app.run(new String[] {"-f", "json", "-o", out.toString(), "-n", "2", in.toString()}));

        File[] written = out.toFile().listFiles();
        assertEquals(1, written.length);
        List<String> lines = Files.readAllLines(written[0].toPath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        JsonNode row = new ObjectMapper().readTree(lines.get(0));
        assertEquals("JWST", row.get("facility_name").asText());
    }

    @Test public void sqlRunWithCustomFields() throws Exception {
        Path fields = Files.write(dir.resolve("fields.txt"),
                ("file_name, string, true, *\n" + "s_ra, double, true, *\n").getBytes(StandardCharsets.UTF_8));
        Path image = FitsFixtures.writeImage(dir.resolve("goods_s.fits").toFile(), "RA---TAN").toPath();
        Path out = Files.createDirectories(dir.resolve("out"));

        assertEquals(0, app.run(new String[] {"-i", fields.toString(), "-o", out.toString(), image.toString()}));

        File[] written = out.toFile().listFiles();
        assertEquals(1, written.length);
        List<String> lines = Files.readAllLines(written[0].toPath(), StandardCharsets.UTF_8);
        assertEquals("insert into sia.jwst (file_name, s_ra) values ('goods_s.fits', 53.25);", lines.get(1));
    }
}
