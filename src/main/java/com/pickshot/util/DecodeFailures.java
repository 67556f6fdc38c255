package com.pickshot.util;

import net.coobird.thumbnailator.tasks.UnsupportedFormatException;

import java.util.List;
import java.util.Locale;

/**
 * Recognises failures caused by the image decoder lacking support for a
 * format, as opposed to a broken or unreadable file.
 */
public final class DecodeFailures {

    private static final List<String> SIGNATURES = List.of(
            "no suitable imagereader",
            "no decoding plugin",
            "bad seek",
            "unsupported image type",
            "no image reader");

    private DecodeFailures() {
    }

    public static boolean isCapabilityFailure(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof UnsupportedFormatException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String normalized = message.toLowerCase(Locale.ROOT);
                for (String signature : SIGNATURES) {
                    if (normalized.contains(signature)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
