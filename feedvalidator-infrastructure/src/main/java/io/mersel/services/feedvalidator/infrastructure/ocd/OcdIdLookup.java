package io.mersel.services.feedvalidator.infrastructure.ocd;

import io.mersel.services.feedvalidator.application.interfaces.IOcdIdDatasetProvider;
import io.mersel.services.feedvalidator.application.interfaces.OcdIdDatasetException;
import io.mersel.services.feedvalidator.application.models.OcdIdDataset;

import java.nio.file.Path;

/**
 * OCD-ID catalogue handle of one validation run.
 * <p>
 * The first call to {@link #dataset()} asks the provider; the outcome, success or
 * failure, is kept so every rule of the run sees the same catalogue and a failed
 * fetch is not retried within the run.
 */
public class OcdIdLookup {

    private final IOcdIdDatasetProvider provider;
    private final String countryCode;
    private final Path localFile;

    private OcdIdDataset dataset;
    private OcdIdDatasetException failure;

    public OcdIdLookup(IOcdIdDatasetProvider provider, String countryCode, Path localFile) {
        this.provider = provider;
        this.countryCode = countryCode == null || countryCode.isBlank() ? null : countryCode.trim();
        this.localFile = localFile;
    }

    public static OcdIdLookup disabled() {
        return new OcdIdLookup(null, null, null);
    }

    /**
     * True when a country code or a local catalogue file is available.
     */
    public boolean isConfigured() {
        return provider != null && (countryCode != null || localFile != null);
    }

    public synchronized OcdIdDataset dataset() throws OcdIdDatasetException {
        if (dataset != null) {
            return dataset;
        }
        if (failure != null) {
            throw failure;
        }
        if (!isConfigured()) {
            failure = new OcdIdDatasetException("No country code or local OCD-ID file configured");
            throw failure;
        }
        try {
            dataset = provider.getDataset(countryCode, localFile);
            return dataset;
        } catch (OcdIdDatasetException e) {
            failure = e;
            throw e;
        }
    }

    /**
     * Catalogue returned by an earlier successful {@link #dataset()} call, else {@code null}.
     */
    public synchronized OcdIdDataset loaded() {
        return dataset;
    }
}
