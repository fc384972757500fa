package com.franchise.resolution.core.model;

/**
 * Resolved display names for one record.
 *
 * @param franchiseName resolved franchise name, or null
 * @param outletName    resolved outlet name, or null
 * @param found         whether the names are known (from storage or a positive lookup)
 */
public record ResolutionResult(String franchiseName, String outletName, boolean found) {

    private static final ResolutionResult NOT_FOUND = new ResolutionResult(null, null, false);

    public ResolutionResult {
        franchiseName = clean(franchiseName);
        outletName = clean(outletName);
    }

    /**
     * Negative result: nothing known for the key.
     */
    public static ResolutionResult notFound() {
        return NOT_FOUND;
    }

    /**
     * Result built from names already persisted on a record. Always {@code found}.
     */
    public static ResolutionResult fromExisting(String franchiseName, String outletName) {
        return new ResolutionResult(franchiseName, outletName, true);
    }

    /**
     * Result of a lookup response; {@code found} iff at least one name is non-blank.
     */
    public static ResolutionResult of(String franchiseName, String outletName) {
        String franchise = clean(franchiseName);
        String outlet = clean(outletName);
        return new ResolutionResult(franchise, outlet, franchise != null || outlet != null);
    }

    public boolean hasAnyName() {
        return franchiseName != null || outletName != null;
    }

    /**
     * True when this result should be written back to storage.
     */
    public boolean isBackfillable() {
        return found && hasAnyName();
    }

    public String franchiseNameOr(String placeholder) {
        return found && franchiseName != null ? franchiseName : placeholder;
    }

    public String outletNameOr(String placeholder) {
        return found && outletName != null ? outletName : placeholder;
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
