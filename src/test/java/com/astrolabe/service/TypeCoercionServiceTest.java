package com.astrolabe.service;

import org.junit.jupiter.api.Test;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertNull;

public class TypeCoercionServiceTest {

    private final TypeCoercionService coercion = new TypeCoercionService();

    @Test public void integerIsParsedBaseTen() {
        assertEquals(42L, coercion.coerce("42", "integer"));
        assertEquals(-7L, coercion.coerce(" -7 ", "integer"));
        assertEquals(908847360L, coercion.coerce("0908847360", "integer"));
    }

    @Test public void integerRejectsFractions() {
        ConversionException e = assertThrows(ConversionException.class, () -> coercion.coerce("4.2", "integer"));
        assertEquals("4.2", e.getValue());
        assertEquals("integer", e.getDatatype());
    }

    @Test public void doubleAcceptsExponents() {
        assertEquals(53.25, coercion.coerce("53.25", "double"));
        assertEquals(-7.78e-6, coercion.coerce("-7.78E-06", "double"));
    }

    @Test public void badDoubleIsConversionError() {
        assertThrows(ConversionException.class, () -> coercion.coerce("RA---TAN", "double"));
    }

    @Test public void nonFiniteDoublesAreConversionErrors() {
        assertThrows(ConversionException.class, () -> coercion.coerce("NaN", "double"));
        assertThrows(ConversionException.class, () -> coercion.coerce("Infinity", "double"));
        assertThrows(ConversionException.class, () -> coercion.coerce("-Infinity", "double"));
        assertNull(coercion.toDouble("NaN"));
    }

    @Test public void stringIsUnchanged() {
        String s = "goods_south";
        assertSame(s, coercion.coerce(s, "string"));
    }

    @Test public void fitsDateWithTime() {
        assertEquals(LocalDateTime.of(2018, 8, 29, 12, 41, 7), coercion.coerce("2018-08-29T12:41:07", "date"));
    }

    @Test public void fitsDateWithoutTime() {
        assertEquals(LocalDateTime.of(2018, 8, 29, 0, 0), coercion.coerce("2018-08-29", "date"));
    }

    @Test public void badDateIsConversionError() {
        assertThrows(ConversionException.class, () -> coercion.coerce("yesterday", "date"));
        assertThrows(ConversionException.class, () -> coercion.coerce("", "date"));
    }

    @Test public void unknownDatatype() {
        UnknownDatatypeException e = assertThrows(UnknownDatatypeException.class, () -> coercion.coerce("1.0", "float"));
        assertEquals("float", e.getDatatype());
    }

    @Test public void datatypeTagIsCaseInsensitive() {
        assertEquals(3L, coercion.coerce("3", "INTEGER"));
    }

    @Test public void formatReproducesCanonicalLiterals() {
        assertEquals("53.25", coercion.format(coercion.coerce("53.25", "double")));
        assertEquals("42", coercion.format(coercion.coerce("42", "integer")));
        assertEquals("image", coercion.format(coercion.coerce("image", "string")));
        assertEquals("2018-08-29T12:41:07", coercion.format(coercion.coerce("2018-08-29T12:41:07", "date")));
        assertNull(coercion.format(null));
    }

    @Test public void lenientDoubleLookup() {
        assertEquals(2000.0, coercion.toDouble("2000.0"));
        assertNull(coercion.toDouble("ICRS"));
        assertNull(coercion.toDouble(null));
    }
}
