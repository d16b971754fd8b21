package com.astrolabe.service;

import com.astrolabe.model.HeaderFields;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.File;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FitsHeaderServiceTest {

    @TempDir
    Path dir;

    private final FitsHeaderService service = new FitsHeaderService();
    private final TypeCoercionService coercion = new TypeCoercionService();

    @Test public void readsPrimaryHeaderCards() throws Exception {
        File f = FitsFixtures.writeImage(dir.resolve("img.fits").toFile(), "RA---TAN");
        HeaderFields h = service.readHeader(f).get();

        assertEquals("-32", h.get("BITPIX"));
        assertEquals("30", h.get("NAXIS1"));
        assertEquals("20", h.get("NAXIS2"));
        assertEquals("RA---TAN", h.get("CTYPE1"));
        assertEquals("F090W", h.get("FILTER"));
        assertEquals("2018-08-29T12:41:07", h.get("DATE-OBS"));
        assertEquals(53.25, coercion.toDouble(h.get("CRVAL1")), 1e-12);
        assertEquals(-7.78e-6, coercion.toDouble(h.get("CD1_1")), 1e-18);
        assertFalse(h.has("END"));
    }

    @Test public void cardOrderIsKept() throws Exception {
        File f = FitsFixtures.writeImage(dir.resolve("img.fits").toFile(), "RA---TAN");
        HeaderFields h = service.readHeader(f).get();
        assertEquals("SIMPLE", h.asMap().keySet().iterator().next());
    }

    @Test public void readsGzippedFiles() throws Exception {
        File plain = FitsFixtures.writeImage(dir.resolve("img.fits").toFile(), "DEC--TAN");
        File gz = dir.resolve("img.fits.gz").toFile();
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz.toPath()))) {
            Files.copy(plain.toPath(), out);
        }
        Optional<HeaderFields> h = service.readHeader(gz);
        assertTrue(h.isPresent());
        assertEquals("DEC--TAN", h.get().get("CTYPE1"));
    }

    @Test public void notAFitsFile() throws Exception {
        Path bad = dir.resolve("bad.fits");
        Files.write(bad, "this is not a FITS file".getBytes(StandardCharsets.US_ASCII));
        assertFalse(service.readHeader(bad.toFile()).isPresent());
    }

    @Test public void missingFile() {
        assertFalse(service.readHeader(dir.resolve("none.fits").toFile()).isPresent());
    }

    @Test public void missingHdu() throws Exception {
        File f = FitsFixtures.writeImage(dir.resolve("img.fits").toFile(), "RA---TAN");
        assertFalse(new FitsHeaderService(3).readHeader(f).isPresent());
    }
}
