package com.astrolabe.service;

import com.astrolabe.model.AliasTable;
import org.junit.jupiter.api.Test;
import java.io.File;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AliasTableLoaderTest {

    private final AliasTableLoader loader = new AliasTableLoader();

    @Test public void bundledAliases() {
        AliasTable aliases = loader.load((File) null);
        assertEquals("s_xel1", aliases.canonicalKeyFor("NAXIS1"));
        assertEquals("filter", aliases.canonicalKeyFor("FILTER"));
        assertNull(aliases.canonicalKeyFor("SUBARRAY"));     // listed as _NOP_
        assertNull(aliases.canonicalKeyFor("_COLUMN_NAMES_"));
    }

    @Test public void markerAndMalformedLinesAreSkipped() {
        AliasTable aliases = loader.load(new StringReader(
            "# aliases\n"
            + "_COLUMN_NAMES_, fitsKey, obsCoreKey\n"
            + "_NOP_, TELESCOP\n"
            + "NAXIS1, s_xel1\n"
            + "NAXIS2\n"
            + "A, b, c\n"
            + " MODULE ,  nircam_module \n"), "test");
        assertEquals(2, aliases.size());
        assertEquals("nircam_module", aliases.canonicalKeyFor("MODULE"));
    }

    @Test public void trailingCommaLineIsIgnored() {
        AliasTable aliases = loader.load(new StringReader("NAXIS1,\nFILTER, filter,\n"), "test");
        assertNull(aliases.canonicalKeyFor("NAXIS1"));
        assertEquals("filter", aliases.canonicalKeyFor("FILTER"));
    }

    @Test public void tableIsReadOnly() {
        AliasTable aliases = loader.load(new StringReader("NAXIS1, s_xel1\n"), "test");
        assertThrows(UnsupportedOperationException.class, () -> aliases.asMap().put("X", "y"));
    }
}
