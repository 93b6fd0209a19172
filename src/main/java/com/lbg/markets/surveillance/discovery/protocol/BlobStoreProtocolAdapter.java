package com.lbg.markets.surveillance.discovery.protocol;

import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobItemProperties;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.ListBlobsOptions;
import com.azure.storage.common.StorageSharedKeyCredential;
import com.lbg.markets.surveillance.discovery.credential.ResolvedCredential;
import com.lbg.markets.surveillance.discovery.domain.BlobSettings;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.ProtocolSettings;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;
import com.lbg.markets.surveillance.discovery.util.FileMatcher;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Lists blobs under {@code blobPrefix + resolvedPath} in one container.
 * Names are matched on their last path segment.
 */
@ApplicationScoped
public class BlobStoreProtocolAdapter implements ProtocolAdapter {

    private static final Logger LOG = Logger.getLogger(BlobStoreProtocolAdapter.class);

    private static final int MAX_PAGE_SIZE = 5000;

    @Override
    public ProtocolType protocol() {
        return ProtocolType.BLOB_STORE;
    }

    @Override
    public List<DiscoveredFile> list(ProtocolSettings settings, ListingRequest request, ResolvedCredential credential)
            throws ProtocolException {
        BlobSettings blob = (BlobSettings) settings;
        String prefix = prefixFor(blob, request.resolvedPath());
        Duration timeout = Duration.ofSeconds(blob.timeoutSeconds());
        String secret = credential.requireSecret();

        try {
            BlobContainerClient container = containerClient(blob, secret);
            ListBlobsOptions options = new ListBlobsOptions()
                    .setPrefix(prefix.isEmpty() ? null : prefix)
                    .setMaxResultsPerPage(Math.min(request.maxResults(), MAX_PAGE_SIZE));

            Instant now = Instant.now();
            List<DiscoveredFile> files = new ArrayList<>();
            for (BlobItem item : container.listBlobs(options, timeout)) {
                if (Boolean.TRUE.equals(item.isPrefix())) {
                    continue;
                }
                String name = filenameOf(item.getName());
                if (name.isEmpty() || !FileMatcher.matches(name, request.namePattern(), request.extension())) {
                    continue;
                }
                if (files.size() >= request.maxResults()) {
                    LOG.warnf("Listing of %s/%s under '%s' truncated at %d entries",
                            blob.accountName(), blob.containerName(), prefix, request.maxResults());
                    break;
                }
                BlobItemProperties properties = item.getProperties();
                long size = properties != null && properties.getContentLength() != null
                        ? properties.getContentLength() : -1;
                Instant modified = properties != null && properties.getLastModified() != null
                        ? properties.getLastModified().toInstant() : null;
                String locator = container.getBlobContainerUrl() + "/" + item.getName();
                files.add(new DiscoveredFile(name, locator, size, modified, now));
            }

            LOG.debugf("Listed %d matching blobs in %s/%s under '%s'",
                    files.size(), blob.accountName(), blob.containerName(), prefix);
            return files;

        } catch (BlobStorageException e) {
            throw fromStatus(e.getStatusCode(), "Blob listing of " + blob.containerName() + " failed: "
                    + e.getErrorCode(), e);
        } catch (RuntimeException e) {
            throw classify(e, "Blob listing of " + blob.containerName() + " failed");
        }
    }

    @Override
    public void testConnection(ProtocolSettings settings, ResolvedCredential credential) throws ProtocolException {
        BlobSettings blob = (BlobSettings) settings;
        String secret = credential.requireSecret();
        try {
            if (!containerClient(blob, secret).exists()) {
                throw ProtocolException.notFound("Container not found: " + blob.containerName());
            }
        } catch (BlobStorageException e) {
            throw fromStatus(e.getStatusCode(), "Container check failed: " + e.getErrorCode(), e);
        } catch (RuntimeException e) {
            throw classify(e, "Container check of " + blob.containerName() + " failed");
        }
    }

    private BlobContainerClient containerClient(BlobSettings blob, String secret) {
        BlobContainerClientBuilder builder = new BlobContainerClientBuilder().containerName(blob.containerName());
        switch (blob.authMode()) {
            case CONNECTION_STRING:
                builder.connectionString(secret);
                if (blob.endpoint() != null && !blob.endpoint().isBlank()) {
                    builder.endpoint(blob.endpoint());
                }
                break;
            case SAS_TOKEN:
                builder.endpoint(endpointFor(blob)).sasToken(secret);
                break;
            case ACCOUNT_KEY:
            default:
                builder.endpoint(endpointFor(blob))
                        .credential(new StorageSharedKeyCredential(blob.accountName(), secret));
                break;
        }
        return builder.buildClient();
    }

    static String endpointFor(BlobSettings blob) {
        if (blob.endpoint() != null && !blob.endpoint().isBlank()) {
            String endpoint = blob.endpoint().trim();
            return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        }
        return "https://" + blob.accountName() + ".blob.core.windows.net";
    }

    static String prefixFor(BlobSettings blob, String resolvedPath) {
        String path = resolvedPath == null ? "" : resolvedPath.replace('\\', '/');
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (!path.isEmpty() && !path.endsWith("/")) {
            path = path + "/";
        }
        String prefix = blob.blobPrefix();
        if (!prefix.isEmpty() && !path.isEmpty() && !prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return prefix + path;
    }

    static String filenameOf(String blobName) {
        int slash = blobName.lastIndexOf('/');
        return slash >= 0 ? blobName.substring(slash + 1) : blobName;
    }

    static ProtocolException fromStatus(int status, String message, Throwable cause) {
        if (status == 401 || status == 403) {
            return new ProtocolException(ProtocolException.Kind.AUTHENTICATION_FAILED, message, cause);
        }
        if (status == 404) {
            return new ProtocolException(ProtocolException.Kind.NOT_FOUND, message, cause);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return ProtocolException.network(message, cause);
        }
        return ProtocolException.protocol(message, cause);
    }

    /**
     * The SDK surfaces timeouts as IllegalStateException wrapping TimeoutException and socket
     * failures as UncheckedIOException; both are transient.
     */
    static ProtocolException classify(RuntimeException e, String message) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof IOException || t instanceof UncheckedIOException) {
                return ProtocolException.network(message + ": " + t.getMessage(), e);
            }
        }
        return ProtocolException.protocol(message + ": " + e.getMessage(), e);
    }
}
