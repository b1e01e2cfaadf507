package io.mersel.services.feedvalidator.infrastructure.ocd;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.feedvalidator.application.interfaces.IOcdIdDatasetProvider;
import io.mersel.services.feedvalidator.application.interfaces.OcdIdDatasetException;
import io.mersel.services.feedvalidator.application.models.DatasetSyncResult;
import io.mersel.services.feedvalidator.application.models.OcdIdDataset;
import io.mersel.services.feedvalidator.infrastructure.config.OcdIdProperties;
import io.mersel.services.feedvalidator.infrastructure.diagnostics.ValidatorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * OCD-ID catalogue provider backed by an on-disk cache of the remote country files.
 * <p>
 * A country file is downloaded when no cached copy exists or when the latest commit
 * touching it is newer than the cached copy. Downloads go to a temporary file that is
 * verified before it atomically replaces the cache; a failed download or verification
 * leaves the existing cache as it was.
 * <p>
 * Loaded catalogues are held in memory per country code (or local file) and each key is
 * loaded at most once, so concurrent callers share a single download.
 */
@Service
public class OcdIdDatasetService implements IOcdIdDatasetProvider {

    private static final Logger log = LoggerFactory.getLogger(OcdIdDatasetService.class);

    private final OcdIdProperties properties;
    private final GitHubCatalogClient client;
    private final OcdIdCsvReader csvReader;
    private final ValidatorMetrics metrics;
    private final Cache<String, OcdIdDataset> datasets;

    public OcdIdDatasetService(OcdIdProperties properties, GitHubCatalogClient client,
                               OcdIdCsvReader csvReader, ValidatorMetrics metrics) {
        this.properties = properties;
        this.client = client;
        this.csvReader = csvReader;
        this.metrics = metrics;
        this.datasets = Caffeine.newBuilder()
                .maximumSize(64)
                .build();
        metrics.registerDatasetCacheSizeGauge(datasets);
    }

    @Override
    public OcdIdDataset getDataset(String countryCode, Path localFile) throws OcdIdDatasetException {
        String key;
        if (localFile != null) {
            key = "local:" + localFile.toAbsolutePath().normalize();
        } else if (countryCode != null && !countryCode.isBlank()) {
            key = normalizeCountry(countryCode);
        } else {
            throw new OcdIdDatasetException("No country code or local OCD-ID file given");
        }

        try {
            return datasets.get(key, k -> {
                try {
                    return acquireAndRecord(countryCode, localFile).dataset();
                } catch (OcdIdDatasetException e) {
                    throw new LoadFailure(e);
                }
            });
        } catch (LoadFailure e) {
            throw e.getCause();
        }
    }

    @Override
    public DatasetSyncResult sync(String countryCode) {
        long start = System.currentTimeMillis();
        if (countryCode == null || countryCode.isBlank()) {
            return DatasetSyncResult.failure(countryCode, 0, "No country code given");
        }
        try {
            Acquired acquired = acquireAndRecord(countryCode, null);
            datasets.put(normalizeCountry(countryCode), acquired.dataset());
            return DatasetSyncResult.success(countryCode, acquired.source(), acquired.dataset().size(),
                    System.currentTimeMillis() - start);
        } catch (OcdIdDatasetException e) {
            return DatasetSyncResult.failure(countryCode, System.currentTimeMillis() - start, e.getMessage());
        }
    }

    @Override
    public Optional<String> findRemoteBlobSha(String countryCode) throws OcdIdDatasetException {
        if (countryCode == null || countryCode.isBlank()) {
            throw new OcdIdDatasetException("No country code given");
        }
        String fileName = OcdIdProperties.countryFileName(normalizeCountry(countryCode));
        try {
            return client.listDirectory().stream()
                    .filter(entry -> fileName.equals(entry.name()))
                    .map(GitHubCatalogClient.RemoteEntry::sha)
                    .findFirst();
        } catch (IOException e) {
            throw new OcdIdDatasetException("Could not list the OCD-ID catalogue directory: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcdIdDatasetException("Interrupted while listing the OCD-ID catalogue directory", e);
        }
    }

    // ── Acquisition ────────────────────────────────────────────────

    private Acquired acquireAndRecord(String countryCode, Path localFile) throws OcdIdDatasetException {
        long start = System.currentTimeMillis();
        try {
            Acquired acquired = localFile != null
                    ? new Acquired(readCatalogue(null, localFile), "local")
                    : acquireCountry(normalizeCountry(countryCode));
            long elapsed = System.currentTimeMillis() - start;
            DatasetSyncResult result = DatasetSyncResult.success(countryCode, acquired.source(),
                    acquired.dataset().size(), elapsed);
            log.info("OCD-ID catalogue loaded: country={}, source={}, entries={}, {}ms",
                    result.countryCode(), result.source(), result.entryCount(), result.durationMs());
            metrics.recordDatasetSync(acquired.source(), true, elapsed);
            return acquired;
        } catch (OcdIdDatasetException e) {
            long elapsed = System.currentTimeMillis() - start;
            DatasetSyncResult result = DatasetSyncResult.failure(countryCode, elapsed, e.getMessage());
            log.error("OCD-ID catalogue could not be loaded: country={}, {}", result.countryCode(), result.error());
            metrics.recordDatasetSync("none", false, elapsed);
            throw e;
        }
    }

    private Acquired acquireCountry(String countryCode) throws OcdIdDatasetException {
        String fileName = OcdIdProperties.countryFileName(countryCode);
        Path cacheFile = Path.of(properties.getCacheDir()).resolve(fileName);
        boolean cached = Files.isRegularFile(cacheFile);

        if (!properties.isCheckGithub()) {
            if (cached) {
                return new Acquired(readCatalogue(countryCode, cacheFile), "cache");
            }
            throw new OcdIdDatasetException("No cached OCD-ID catalogue at " + cacheFile
                    + " and remote checks are disabled");
        }

        Instant latestCommit;
        try {
            latestCommit = client.latestCommitDate(properties.getGithubDir() + "/" + fileName);
        } catch (IOException e) {
            if (cached) {
                log.warn("Latest commit of {} could not be queried, using cached copy: {}", fileName, e.getMessage());
                return new Acquired(readCatalogue(countryCode, cacheFile), "cache");
            }
            throw new OcdIdDatasetException("Could not query the latest commit of " + fileName + ": "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcdIdDatasetException("Interrupted while querying the latest commit of " + fileName, e);
        }

        if (cached && !isStale(cacheFile, latestCommit)) {
            log.debug("Cached {} is up to date (latest commit {})", cacheFile, latestCommit);
            return new Acquired(readCatalogue(countryCode, cacheFile), "cache");
        }

        download(fileName, cacheFile);
        return new Acquired(readCatalogue(countryCode, cacheFile), "download");
    }

    /**
     * Downloads to {@code <cache>.tmp}, verifies the content and moves it over the cache.
     */
    private void download(String fileName, Path cacheFile) throws OcdIdDatasetException {
        Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        try {
            Files.createDirectories(cacheFile.toAbsolutePath().getParent());
            client.downloadTo(fileName, tmp);
            int entries = csvReader.verify(tmp);
            moveIntoPlace(tmp, cacheFile);
            log.info("OCD-ID catalogue {} refreshed: {} entries", cacheFile, entries);
        } catch (IOException e) {
            throw new OcdIdDatasetException("Downloading " + fileName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcdIdDatasetException("Interrupted while downloading " + fileName, e);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("Temporary file {} could not be deleted: {}", tmp, e.getMessage());
            }
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isStale(Path cacheFile, Instant latestCommit) {
        try {
            return Files.getLastModifiedTime(cacheFile).toInstant().isBefore(latestCommit);
        } catch (IOException e) {
            log.warn("Modification time of {} unreadable, treating as stale: {}", cacheFile, e.getMessage());
            return true;
        }
    }

    private OcdIdDataset readCatalogue(String countryCode, Path file) throws OcdIdDatasetException {
        if (!Files.isRegularFile(file)) {
            throw new OcdIdDatasetException("OCD-ID catalogue not found: " + file);
        }
        try {
            Map<String, String> entries = csvReader.read(file);
            return new OcdIdDataset(countryCode, file.toString(), entries);
        } catch (IOException e) {
            throw new OcdIdDatasetException("OCD-ID catalogue " + file + " could not be read: " + e.getMessage(), e);
        }
    }

    private static String normalizeCountry(String countryCode) {
        return countryCode.trim().toLowerCase(Locale.ROOT);
    }

    private record Acquired(OcdIdDataset dataset, String source) {
    }

    /**
     * Carries a checked load failure out of the cache loader.
     */
    private static final class LoadFailure extends RuntimeException {

        LoadFailure(OcdIdDatasetException cause) {
            super(cause);
        }

        @Override
        public synchronized OcdIdDatasetException getCause() {
            return (OcdIdDatasetException) super.getCause();
        }
    }
}
