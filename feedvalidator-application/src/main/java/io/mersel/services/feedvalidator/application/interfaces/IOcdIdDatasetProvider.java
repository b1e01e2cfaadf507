package io.mersel.services.feedvalidator.application.interfaces;

import io.mersel.services.feedvalidator.application.models.DatasetSyncResult;
import io.mersel.services.feedvalidator.application.models.OcdIdDataset;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Supplies the OCD-ID catalogue of a country.
 * <p>
 * A local catalogue file takes precedence. Otherwise the catalogue is read from the
 * on-disk cache, which is refreshed from the remote repository when the latest commit
 * touching the country file is newer than the cached copy.
 */
public interface IOcdIdDatasetProvider {

    /**
     * Returns the catalogue, loading it at most once per country code.
     *
     * @param countryCode Two letter country code, ignored when {@code localFile} is set
     * @param localFile   Local catalogue, may be {@code null}
     * @throws OcdIdDatasetException the catalogue could not be fetched, verified or read
     */
    OcdIdDataset getDataset(String countryCode, Path localFile) throws OcdIdDatasetException;

    /**
     * Brings the cached catalogue of a country up to date and reports what happened.
     * Never throws; failures are described by the result.
     */
    DatasetSyncResult sync(String countryCode);

    /**
     * Looks up the content hash of the country file in the remote directory listing.
     *
     * @return the blob hash, or empty when the file is not listed
     * @throws OcdIdDatasetException the listing could not be fetched
     */
    Optional<String> findRemoteBlobSha(String countryCode) throws OcdIdDatasetException;
}
