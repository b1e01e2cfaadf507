package io.mersel.services.feedvalidator.infrastructure.ocd;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.feedvalidator.infrastructure.config.OcdIdProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Talks to the repository hosting the OCD-ID catalogues: commit history, raw file
 * download and directory listing.
 */
@Component
public class GitHubCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubCatalogClient.class);

    /**
     * One entry of a remote directory listing.
     *
     * @param name File name
     * @param sha  Git blob hash of the content
     */
    public record RemoteEntry(String name, String sha) {
    }

    private final OcdIdProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public GitHubCatalogClient(OcdIdProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    /**
     * Constructor with injectable HttpClient for testing.
     */
    GitHubCatalogClient(OcdIdProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    /**
     * Committer date of the most recent commit touching the given repository path.
     *
     * @throws IOException the request failed or no commit touches the path
     */
    public Instant latestCommitDate(String path) throws IOException, InterruptedException {
        String url = properties.getApiBaseUrl() + "/repos/" + properties.getGithubRepo()
                + "/commits?path=" + URLEncoder.encode(path, StandardCharsets.UTF_8) + "&per_page=1";
        JsonNode commits = getJson(url);
        if (!commits.isArray() || commits.isEmpty()) {
            throw new IOException("No commit found for " + path);
        }
        String date = commits.get(0).path("commit").path("committer").path("date").asText(null);
        if (date == null) {
            throw new IOException("Commit of " + path + " has no committer date");
        }
        try {
            return Instant.parse(date);
        } catch (DateTimeParseException e) {
            throw new IOException("Unparsable committer date '" + date + "' for " + path, e);
        }
    }

    /**
     * Streams the raw catalogue file to {@code target}, overwriting it.
     *
     * @throws IOException the request failed or did not answer 200
     */
    public void downloadTo(String fileName, Path target) throws IOException, InterruptedException {
        String url = properties.getRawBaseUrl() + "/" + properties.getGithubRepo() + "/master/"
                + properties.getGithubDir() + "/" + fileName;
        log.info("Downloading OCD-ID catalogue: {}", url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .GET()
                .build();
        HttpResponse<Path> response = exchange(request, HttpResponse.BodyHandlers.ofFile(target));
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " - URL: " + url);
        }
    }

    /**
     * Entries of the catalogue directory.
     */
    public List<RemoteEntry> listDirectory() throws IOException, InterruptedException {
        String url = properties.getApiBaseUrl() + "/repos/" + properties.getGithubRepo()
                + "/contents/" + properties.getGithubDir();
        JsonNode listing = getJson(url);
        if (!listing.isArray()) {
            throw new IOException("Unexpected directory listing from " + url);
        }
        List<RemoteEntry> entries = new ArrayList<>();
        for (JsonNode entry : listing) {
            entries.add(new RemoteEntry(entry.path("name").asText(), entry.path("sha").asText(null)));
        }
        return entries;
    }

    private JsonNode getJson(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .header("Accept", "application/vnd.github+json")
                .GET()
                .build();
        HttpResponse<String> response = exchange(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " - URL: " + url);
        }
        log.debug("GET {} -> {}", url, response.statusCode());
        return objectMapper.readTree(response.body());
    }

    /**
     * Sends the request and waits at most {@code read-timeout-ms} for the complete
     * response, body included. The request timeout alone only covers the headers.
     *
     * @throws HttpTimeoutException the response did not complete in time
     */
    private <T> HttpResponse<T> exchange(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
            throws IOException, InterruptedException {
        long timeoutMs = properties.getReadTimeoutMs();
        CompletableFuture<HttpResponse<T>> future = httpClient.sendAsync(request, bodyHandler);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("No complete response within " + timeoutMs + "ms - URL: " + request.uri());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Request failed - URL: " + request.uri() + " (" + cause + ")", cause);
        }
    }
}
