package com.lbg.markets.surveillance.discovery.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.discovery.credential.ResolvedCredential;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.ProtocolSettings;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;
import com.lbg.markets.surveillance.discovery.domain.WebSettings;
import com.lbg.markets.surveillance.discovery.util.FileMatcher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Discovers files behind an HTTPS endpoint.
 * <p>
 * If the endpoint answers with a JSON array of {@code {name, url, size, lastModified}} entries
 * that array is filtered. Any other body means the server has no listing capability: a literal
 * name pattern is then probed with a HEAD request, while a wildcard pattern treats the
 * requested URL itself as the single candidate file.
 */
@ApplicationScoped
public class WebProtocolAdapter implements ProtocolAdapter {

    private static final Logger LOG = Logger.getLogger(WebProtocolAdapter.class);

    @Inject
    ObjectMapper objectMapper;

    @Override
    public ProtocolType protocol() {
        return ProtocolType.WEB;
    }

    @Override
    public List<DiscoveredFile> list(ProtocolSettings settings, ListingRequest request, ResolvedCredential credential)
            throws ProtocolException {
        WebSettings web = (WebSettings) settings;
        HttpClient client = newClient(web);
        URI uri = resolve(web.baseUrl(), request.resolvedPath());

        HttpResponse<String> response = send(client, authorized(web, credential, uri).GET().build());
        checkStatus(response, uri);

        String body = response.body() != null ? response.body().trim() : "";
        if (body.startsWith("[")) {
            return fromListing(uri, body, request);
        }

        if (!FileMatcher.hasWildcards(request.namePattern())) {
            return probe(client, web, credential, uri, request);
        }

        String name = lastSegment(uri);
        if (name.isEmpty() || !FileMatcher.matches(name, request.namePattern(), request.extension())) {
            return List.of();
        }
        long size = response.headers().firstValueAsLong("Content-Length").orElse(body.length());
        return List.of(new DiscoveredFile(name, uri.toString(), size, lastModified(response), Instant.now()));
    }

    @Override
    public void testConnection(ProtocolSettings settings, ResolvedCredential credential) throws ProtocolException {
        WebSettings web = (WebSettings) settings;
        URI uri = URI.create(web.baseUrl());
        HttpResponse<String> response = send(newClient(web),
                authorized(web, credential, uri).method("HEAD", HttpRequest.BodyPublishers.noBody()).build());
        if (response.statusCode() != 404) {
            checkStatus(response, uri);
        }
    }

    private List<DiscoveredFile> fromListing(URI base, String body, ListingRequest request) throws ProtocolException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw ProtocolException.protocol("Malformed JSON listing from " + base + ": " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            throw ProtocolException.protocol("Listing from " + base + " is not a JSON array", null);
        }

        Instant now = Instant.now();
        List<DiscoveredFile> files = new ArrayList<>();
        for (JsonNode entry : root) {
            String name = entry.path("name").asText("");
            if (name.isEmpty() || !FileMatcher.matches(name, request.namePattern(), request.extension())) {
                continue;
            }
            if (files.size() >= request.maxResults()) {
                LOG.warnf("Listing of %s truncated at %d entries", base, request.maxResults());
                break;
            }
            String url = entry.hasNonNull("url") ? base.resolve(entry.get("url").asText()).toString()
                    : childUri(base, name).toString();
            long size = entry.path("size").asLong(-1);
            files.add(new DiscoveredFile(name, url, size, parseInstant(entry.path("lastModified").asText(null)), now));
        }
        LOG.debugf("Listing %s returned %d matching files", base, files.size());
        return files;
    }

    private List<DiscoveredFile> probe(HttpClient client, WebSettings web, ResolvedCredential credential, URI base,
                                       ListingRequest request) throws ProtocolException {
        String name = request.namePattern();
        if (!FileMatcher.matchesExtension(name, request.extension())) {
            return List.of();
        }
        URI target = childUri(base, name);
        HttpResponse<String> response = send(client,
                authorized(web, credential, target).method("HEAD", HttpRequest.BodyPublishers.noBody()).build());
        if (response.statusCode() == 404) {
            LOG.debugf("Probe for %s found nothing", target);
            return List.of();
        }
        checkStatus(response, target);
        long size = response.headers().firstValueAsLong("Content-Length").orElse(-1);
        return List.of(new DiscoveredFile(name, target.toString(), size, lastModified(response), Instant.now()));
    }

    private HttpClient newClient(WebSettings web) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(web.timeoutSeconds()))
                .followRedirects(web.followRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();
    }

    private HttpRequest.Builder authorized(WebSettings web, ResolvedCredential credential, URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(web.timeoutSeconds()))
                .header("Accept", "application/json, */*;q=0.8");

        switch (web.authMode()) {
            case BASIC:
                String pair = web.username() + ":" + credential.requireSecret();
                builder.header("Authorization",
                        "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
                break;
            case BEARER:
                builder.header("Authorization", "Bearer " + credential.requireSecret());
                break;
            case API_KEY:
                builder.header(web.apiKeyHeader(), credential.requireSecret());
                break;
            case NONE:
            default:
                break;
        }
        return builder;
    }

    private HttpResponse<String> send(HttpClient client, HttpRequest request) throws ProtocolException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ProtocolException.network("Timed out calling " + request.uri(), e);
        } catch (IOException e) {
            throw ProtocolException.network("I/O failure calling " + request.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProtocolException.network("Interrupted calling " + request.uri(), e);
        }
    }

    static void checkStatus(HttpResponse<?> response, URI uri) throws ProtocolException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String message = "HTTP " + status + " from " + uri;
        if (status == 401 || status == 403) {
            throw ProtocolException.authentication(message);
        }
        if (status == 404 || status == 410) {
            throw ProtocolException.notFound(message);
        }
        if (status == 408 || status == 429 || status >= 500) {
            throw ProtocolException.network(message, null);
        }
        throw ProtocolException.protocol(message, null);
    }

    static URI resolve(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (path == null || path.isBlank()) {
            return URI.create(base);
        }
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create(base + suffix);
    }

    private static URI childUri(URI base, String name) {
        String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20");
        String text = base.toString();
        return URI.create(text.endsWith("/") ? text + encoded : text + "/" + encoded);
    }

    private static String lastSegment(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static Instant lastModified(HttpResponse<?> response) {
        Optional<String> header = response.headers().firstValue("Last-Modified");
        if (header.isEmpty()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(header.get(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable Last-Modified header: %s", header.get());
            return null;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable lastModified value: %s", value);
            return null;
        }
    }
}
