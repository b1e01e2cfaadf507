package io.mersel.services.feedvalidator.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

/**
 * OCD-ID catalogue settings.
 * <p>
 * Reads values under the {@code feed-validator.ocd} prefix.
 * <ul>
 *   <li>{@code country-code} Default country of the catalogue (empty disables OCD-ID rules)</li>
 *   <li>{@code local-file} Local catalogue used instead of the remote one</li>
 *   <li>{@code cache-dir} Directory holding one cached catalogue per country</li>
 *   <li>{@code github-repo}, {@code github-dir} Repository and directory of the country files</li>
 *   <li>{@code raw-base-url}, {@code api-base-url} Content and API hosts (overridable for tests)</li>
 *   <li>{@code check-github} When false an existing cache is used without any network access</li>
 *   <li>{@code connect-timeout-ms}, {@code read-timeout-ms} HTTP timeouts (must be positive)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "feed-validator.ocd")
public class OcdIdProperties {

    private static final Logger log = LoggerFactory.getLogger(OcdIdProperties.class);

    private String countryCode = "";
    private String localFile = "";
    private String cacheDir = System.getProperty("user.home") + "/.cache/feed-validator";
    private String githubRepo = "opencivicdata/ocd-division-ids";
    private String githubDir = "identifiers";
    private String rawBaseUrl = "https://raw.github.com";
    private String apiBaseUrl = "https://api.github.com";
    private boolean checkGithub = true;
    private int connectTimeoutMs = 10000;
    private int readTimeoutMs = 60000;

    @PostConstruct
    void validate() {
        if (connectTimeoutMs <= 0) {
            log.warn("connect-timeout-ms must be positive (given: {}), using 10000 ms", connectTimeoutMs);
            connectTimeoutMs = 10000;
        }
        if (readTimeoutMs <= 0) {
            log.warn("read-timeout-ms must be positive (given: {}), using 60000 ms", readTimeoutMs);
            readTimeoutMs = 60000;
        }
        if (countryCode != null && !countryCode.isBlank() && !countryCode.trim().matches("[A-Za-z]{2}")) {
            log.warn("country-code should be a two letter code (given: {})", countryCode);
        }
        rawBaseUrl = stripTrailingSlash(rawBaseUrl);
        apiBaseUrl = stripTrailingSlash(apiBaseUrl);
    }

    private static String stripTrailingSlash(String url) {
        return url == null ? "" : url.replaceAll("/+$", "");
    }

    /**
     * Cache file name of a country, e.g. {@code country-us.csv}.
     */
    public static String countryFileName(String countryCode) {
        return "country-" + countryCode.trim().toLowerCase(Locale.ROOT) + ".csv";
    }

    public String getCountryCode() {
        return countryCode;
    }

    public void setCountryCode(String countryCode) {
        this.countryCode = countryCode;
    }

    public String getLocalFile() {
        return localFile;
    }

    public void setLocalFile(String localFile) {
        this.localFile = localFile;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public String getGithubRepo() {
        return githubRepo;
    }

    public void setGithubRepo(String githubRepo) {
        this.githubRepo = githubRepo;
    }

    public String getGithubDir() {
        return githubDir;
    }

    public void setGithubDir(String githubDir) {
        this.githubDir = githubDir;
    }

    public String getRawBaseUrl() {
        return rawBaseUrl;
    }

    public void setRawBaseUrl(String rawBaseUrl) {
        this.rawBaseUrl = rawBaseUrl;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public boolean isCheckGithub() {
        return checkGithub;
    }

    public void setCheckGithub(boolean checkGithub) {
        this.checkGithub = checkGithub;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
