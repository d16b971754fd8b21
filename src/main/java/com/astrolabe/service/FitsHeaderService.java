package com.astrolabe.service;

import com.astrolabe.model.HeaderFields;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class FitsHeaderService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FitsHeaderService.class);

    private final int hduIndex;

    public FitsHeaderService() {
        this(0);
    }

    public FitsHeaderService(int hduIndex) {
        this.hduIndex = hduIndex;
    }

    /**
     * Reads the key/value cards (comments and blank cards dropped) of the configured HDU.
     * Returns empty, without throwing, if the file is not a readable FITS file.
     */
    public Optional<HeaderFields> readHeader(File f) {
        // nom-tam detects gzip compression from the file itself
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(hduIndex);
            if (hdu == null) {
                LOGGER.error("No HDU {} in file '{}'. File skipped.", hduIndex, f.getAbsolutePath());
                return Optional.empty();
            }
            return Optional.of(toHeaderFields(hdu.getHeader()));
        } catch (Exception e) {
            LOGGER.error("Invalid FITS Header encountered in file '{}'. File skipped. ({})",
                    f.getAbsolutePath(), e.getMessage());
            return Optional.empty();
        }
    }

    static HeaderFields toHeaderFields(Header header) {
        Map<String, String> cards = new LinkedHashMap<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            if (!card.isKeyValuePair()) continue;
            String value = card.getValue();
            cards.put(card.getKey(), (value != null) ? value.trim() : null);
        }
        return new HeaderFields(cards);
    }
}
