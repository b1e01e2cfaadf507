package io.mersel.services.feedvalidator.application.models;

import java.util.Map;
import java.util.Set;

/**
 * Catalogue of valid OCD-IDs for one country.
 *
 * @param countryCode Country code, {@code null} for a local catalogue file
 * @param source      Where the entries were read from (cache file or local file path)
 * @param entries     OCD-ID to division name
 */
public record OcdIdDataset(String countryCode, String source, Map<String, String> entries) {

    public OcdIdDataset {
        entries = Map.copyOf(entries);
    }

    public boolean contains(String ocdId) {
        return ocdId != null && entries.containsKey(ocdId);
    }

    public Set<String> ids() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
