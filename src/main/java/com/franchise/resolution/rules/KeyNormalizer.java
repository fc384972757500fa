package com.franchise.resolution.rules;

import com.franchise.resolution.core.model.ResolutionKey;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes raw franchise/outlet ids into {@link ResolutionKey}s.
 *
 * <p>Two modes are available:</p>
 * <ul>
 *   <li>{@link #trimming()} - trims surrounding whitespace only</li>
 *   <li>{@link #digitsOnly()} - trims and strips every non-digit character, matching the
 *       numeric ids accepted by the franchise API</li>
 * </ul>
 * An id that is null or empty after normalization makes the key unresolvable.
 */
public final class KeyNormalizer {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private static final KeyNormalizer TRIMMING = new KeyNormalizer(false);
    private static final KeyNormalizer DIGITS_ONLY = new KeyNormalizer(true);

    private final boolean stripNonDigits;

    private KeyNormalizer(boolean stripNonDigits) {
        this.stripNonDigits = stripNonDigits;
    }

    public static KeyNormalizer trimming() {
        return TRIMMING;
    }

    public static KeyNormalizer digitsOnly() {
        return DIGITS_ONLY;
    }

    public static KeyNormalizer of(boolean digitsOnly) {
        return digitsOnly ? DIGITS_ONLY : TRIMMING;
    }

    public boolean isDigitsOnly() {
        return stripNonDigits;
    }

    /**
     * Cleans a single id. Returns an empty string for null input.
     */
    public String cleanId(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        return stripNonDigits ? NON_DIGITS.matcher(trimmed).replaceAll("") : trimmed;
    }

    /**
     * Normalizes both ids into a key.
     *
     * @return the key, or empty if either id is blank after cleaning
     */
    public Optional<ResolutionKey> normalize(String franchiseId, String outletId) {
        String fid = cleanId(franchiseId);
        String oid = cleanId(outletId);
        if (fid.isEmpty() || oid.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResolutionKey(fid, oid));
    }

    @Override
    public String toString() {
        return stripNonDigits ? "KeyNormalizer[digitsOnly]" : "KeyNormalizer[trimming]";
    }
}
