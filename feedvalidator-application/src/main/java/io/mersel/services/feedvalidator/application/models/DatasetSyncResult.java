package io.mersel.services.feedvalidator.application.models;

/**
 * Outcome of acquiring an OCD-ID catalogue.
 *
 * @param countryCode Requested country code
 * @param success     Catalogue loaded and verified
 * @param source      "local", "cache" or "download"
 * @param entryCount  Number of loaded entries
 * @param durationMs  Duration in milliseconds
 * @param error       Error message when unsuccessful
 */
public record DatasetSyncResult(
        String countryCode,
        boolean success,
        String source,
        int entryCount,
        long durationMs,
        String error
) {

    public static DatasetSyncResult success(String countryCode, String source, int entryCount, long durationMs) {
        return new DatasetSyncResult(countryCode, true, source, entryCount, durationMs, null);
    }

    public static DatasetSyncResult failure(String countryCode, long durationMs, String error) {
        return new DatasetSyncResult(countryCode, false, null, 0, durationMs, error);
    }
}
