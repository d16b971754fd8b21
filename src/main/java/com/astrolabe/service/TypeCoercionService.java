package com.astrolabe.service;

import com.astrolabe.model.DataType;
import nom.tam.fits.FitsDate;
import nom.tam.fits.FitsException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * Converts header and default value strings to typed values: integer to Long, double to
 * Double, string unchanged, date to a UTC LocalDateTime.
 */
public class TypeCoercionService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter DATE_FORMAT_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    /**
     * Converts the value string to the datatype named by the tag.
     * @throws UnknownDatatypeException if the tag is not integer, double, string or date
     * @throws ConversionException if the string does not parse as that datatype
     */
    public Object coerce(String valueStr, String datatypeTag) {
        DataType type = DataType.fromTag(datatypeTag);
        if (type == null) throw new UnknownDatatypeException(valueStr, datatypeTag);
        return coerce(valueStr, type);
    }

    public Object coerce(String valueStr, DataType type) {
        if (valueStr == null) throw new ConversionException(null, type.getTag(), null);
        switch (type) {
            case INTEGER:
                try {
                    return Long.parseLong(valueStr.trim(), 10);
                } catch (NumberFormatException e) {
                    throw new ConversionException(valueStr, type.getTag(), e);
                }
            case DOUBLE:
                double d;
                try {
                    d = Double.parseDouble(valueStr.trim());
                } catch (NumberFormatException e) {
                    throw new ConversionException(valueStr, type.getTag(), e);
                }
                // NaN and Infinity have no SQL or JSON literal
                if (Double.isNaN(d) || Double.isInfinite(d)) throw new ConversionException(valueStr, type.getTag(), null);
                return d;
            case STRING:
                return valueStr;
            case DATE:
                return parseFitsDate(valueStr, type);
            default:
                throw new UnknownDatatypeException(valueStr, type.getTag());
        }
    }

    /** Lenient double lookup for geometry inputs: null when absent or unparsable. */
    public Double toDouble(String valueStr) {
        if (valueStr == null) return null;
        try {
            return (Double) coerce(valueStr, DataType.DOUBLE);
        } catch (ConversionException e) {
            return null;
        }
    }

    /** Renders a typed value back to the literal form it was parsed from. */
    public String format(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDateTime) {
            LocalDateTime dt = (LocalDateTime) value;
            return (dt.getNano() == 0) ? dt.format(DATE_FORMAT) : dt.format(DATE_FORMAT_MILLIS);
        }
        return value.toString();
    }

    // FITS date = ISO-8601 w/o the trailing Z, or a bare date
    private LocalDateTime parseFitsDate(String valueStr, DataType type) {
        String s = valueStr.trim();
        if (s.isEmpty()) throw new ConversionException(valueStr, type.getTag(), null);
        Date date;
        try {
            date = new FitsDate(s).toDate();
        } catch (FitsException | IllegalArgumentException e) {
            throw new ConversionException(valueStr, type.getTag(), e);
        }
        if (date == null) throw new ConversionException(valueStr, type.getTag(), null);
        return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
    }
}
