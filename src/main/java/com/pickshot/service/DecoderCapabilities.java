package com.pickshot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide record of what the in-process decoder can handle, per format
 * family ("heif", ...).
 *
 * A family starts out unknown. Once it has been seen to fail for lack of
 * decoder support it stays unavailable until {@link #reset()}. Reader lookups
 * by file suffix are cached the same way.
 */
@Component
public class DecoderCapabilities {

    private static final Logger log = LoggerFactory.getLogger(DecoderCapabilities.class);

    private final Map<String, Boolean> fastDecoderSupport = new ConcurrentHashMap<>();
    private final Map<String, Boolean> readerBySuffix = new ConcurrentHashMap<>();

    /**
     * @return empty while the family has not been checked or tried yet
     */
    public Optional<Boolean> fastDecoderSupport(String family) {
        return Optional.ofNullable(fastDecoderSupport.get(family));
    }

    public boolean isFastDecoderUnavailable(String family) {
        return Boolean.FALSE.equals(fastDecoderSupport.get(family));
    }

    /**
     * Stores a reader lookup result unless something is already known.
     */
    public void recordLookup(String family, boolean supported) {
        fastDecoderSupport.putIfAbsent(family, supported);
    }

    public void markFastDecoderUnavailable(String family) {
        Boolean previous = fastDecoderSupport.put(family, Boolean.FALSE);
        if (!Boolean.FALSE.equals(previous)) {
            log.info("In-process decoder cannot read '{}' images; using the fallback converter from now on", family);
        }
    }

    /**
     * True if an installed ImageIO reader claims the file suffix.
     */
    public boolean hasReaderForSuffix(String suffix) {
        return readerBySuffix.computeIfAbsent(suffix.toLowerCase(Locale.ROOT),
                s -> ImageIO.getImageReadersBySuffix(s).hasNext());
    }

    public void reset() {
        fastDecoderSupport.clear();
        readerBySuffix.clear();
    }
}
