package com.pickshot.util;

import java.util.List;
import java.util.Map;

/**
 * Converts raw metadata values into 0..5 star ratings.
 *
 * Ratings show up either as stars (0..5) or as a percentage (0..100) depending
 * on the field. Anything above 5 is taken to be a percentage.
 */
public final class RatingNormalizer {

    /** Tag names checked in order when reading a rating. */
    public static final List<String> RATING_TAGS = List.of("Rating", "XMP:Rating", "XmpRating", "RatingPercent");

    private RatingNormalizer() {
    }

    /**
     * Clamps a value to 0..5 and rounds it. Non-finite values become 0.
     */
    public static int clamp(double value) {
        if (!Double.isFinite(value))
            return 0;
        return (int) Math.min(5, Math.max(0, Math.round(value)));
    }

    /**
     * Normalizes a raw tag value.
     *
     * @return the star rating, or null when the value is absent or not a
     *         number
     */
    public static Integer normalize(Object raw) {
        if (raw == null)
            return null;
        double numeric;
        if (raw instanceof Number) {
            numeric = ((Number) raw).doubleValue();
        } else if (raw instanceof String && !((String) raw).isBlank()) {
            try {
                numeric = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        if (!Double.isFinite(numeric))
            return null;
        if (numeric > 5) {
            return clamp(numeric / 20);
        }
        return clamp(numeric);
    }

    /**
     * Returns the first usable rating among {@link #RATING_TAGS}.
     */
    public static Integer extract(Map<String, ?> tags) {
        for (String tag : RATING_TAGS) {
            Integer rating = normalize(tags.get(tag));
            if (rating != null) {
                return rating;
            }
        }
        return null;
    }

    public static int toPercent(int rating) {
        return clamp(rating) * 20;
    }
}
