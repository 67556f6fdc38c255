package com.pickshot.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Per-format policy for sources that the primary decoder may not handle.
 */
public final class TranscodeRule {

    public enum Fallback {
        /** Convert with an external tool run by the isolated fallback worker. */
        EXTERNAL_CONVERTER
    }

    /** HEIC/HEIF: try the in-process decoder first, re-encode as JPEG q92. */
    public static final TranscodeRule HEIF = new TranscodeRule("heif", Set.of("heic", "heif"),
            true, Fallback.EXTERNAL_CONVERTER, "jpg", 0.92);

    private static final List<TranscodeRule> RULES = List.of(HEIF);

    private final String family;
    private final Set<String> extensions;
    private final boolean trustPrimaryDecoder;
    private final Fallback fallback;
    private final String targetExtension;
    private final double quality;

    public TranscodeRule(String family, Set<String> extensions, boolean trustPrimaryDecoder,
            Fallback fallback, String targetExtension, double quality) {
        this.family = family;
        this.extensions = extensions;
        this.trustPrimaryDecoder = trustPrimaryDecoder;
        this.fallback = fallback;
        this.targetExtension = targetExtension;
        this.quality = quality;
    }

    /**
     * Looks up the rule for a file by its extension.
     */
    public static Optional<TranscodeRule> forFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return RULES.stream().filter(r -> r.extensions.contains(ext)).findFirst();
    }

    public String getFamily() {
        return family;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    /** Whether the in-process decoder should be tried before the fallback. */
    public boolean isTrustPrimaryDecoder() {
        return trustPrimaryDecoder;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public String getTargetExtension() {
        return targetExtension;
    }

    /** JPEG quality in 0..1. */
    public double getQuality() {
        return quality;
    }
}
