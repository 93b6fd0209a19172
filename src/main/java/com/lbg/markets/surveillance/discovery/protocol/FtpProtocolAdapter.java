package com.lbg.markets.surveillance.discovery.protocol;

import com.lbg.markets.surveillance.discovery.credential.ResolvedCredential;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.FtpSettings;
import com.lbg.markets.surveillance.discovery.domain.ProtocolSettings;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;
import com.lbg.markets.surveillance.discovery.util.FileMatcher;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.net.MalformedServerReplyException;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists a directory on an FTP server, optionally upgraded to explicit FTPS.
 */
@ApplicationScoped
public class FtpProtocolAdapter implements ProtocolAdapter {

    private static final Logger LOG = Logger.getLogger(FtpProtocolAdapter.class);

    @Override
    public ProtocolType protocol() {
        return ProtocolType.FTP;
    }

    @Override
    public List<DiscoveredFile> list(ProtocolSettings settings, ListingRequest request, ResolvedCredential credential)
            throws ProtocolException {
        FtpSettings ftp = (FtpSettings) settings;
        String directory = normalizeDirectory(request.resolvedPath());
        FTPClient client = newClient(ftp);

        try {
            open(client, ftp, credential);

            if (!client.changeWorkingDirectory(directory)) {
                if (client.getReplyCode() == FTPReply.FILE_UNAVAILABLE) {
                    throw ProtocolException.notFound("Directory not found: " + directory);
                }
                throw ProtocolException.protocol("CWD " + directory + " rejected: " + client.getReplyString().trim(), null);
            }

            FTPFile[] entries = client.listFiles();
            if (entries == null) {
                throw ProtocolException.protocol("LIST returned no data for " + directory, null);
            }

            Instant now = Instant.now();
            List<DiscoveredFile> files = new ArrayList<>();
            for (FTPFile entry : entries) {
                if (entry == null || !entry.isFile()) {
                    continue;
                }
                String name = entry.getName();
                if (!FileMatcher.matches(name, request.namePattern(), request.extension())) {
                    continue;
                }
                if (files.size() >= request.maxResults()) {
                    LOG.warnf("Listing of ftp://%s:%d%s truncated at %d entries",
                            ftp.host(), ftp.port(), directory, request.maxResults());
                    break;
                }
                Instant modified = entry.getTimestamp() != null ? entry.getTimestamp().toInstant() : null;
                files.add(new DiscoveredFile(name, locator(ftp, directory, name), entry.getSize(), modified, now));
            }

            LOG.debugf("Listed %d matching files in ftp://%s:%d%s", files.size(), ftp.host(), ftp.port(), directory);
            return files;

        } catch (MalformedServerReplyException e) {
            throw ProtocolException.protocol("Malformed reply from " + ftp.host() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw ProtocolException.network("FTP I/O failure talking to " + ftp.host() + ": " + e.getMessage(), e);
        } finally {
            close(client, ftp);
        }
    }

    @Override
    public void testConnection(ProtocolSettings settings, ResolvedCredential credential) throws ProtocolException {
        FtpSettings ftp = (FtpSettings) settings;
        FTPClient client = newClient(ftp);
        try {
            open(client, ftp, credential);
        } catch (IOException e) {
            throw ProtocolException.network("FTP connection to " + ftp.host() + " failed: " + e.getMessage(), e);
        } finally {
            close(client, ftp);
        }
    }

    private FTPClient newClient(FtpSettings ftp) {
        FTPClient client = ftp.useTls() ? new FTPSClient(false) : new FTPClient();
        int timeoutMillis = ftp.timeoutSeconds() * 1000;
        client.setConnectTimeout(timeoutMillis);
        client.setDefaultTimeout(timeoutMillis);
        client.setDataTimeout(Duration.ofSeconds(ftp.timeoutSeconds()));
        return client;
    }

    private void open(FTPClient client, FtpSettings ftp, ResolvedCredential credential)
            throws IOException, ProtocolException {
        client.connect(ftp.host(), ftp.port());
        if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
            throw ProtocolException.network("FTP server " + ftp.host() + " refused connection: "
                    + client.getReplyString().trim(), null);
        }
        client.setSoTimeout(ftp.timeoutSeconds() * 1000);

        String password = credential.isPresent() ? credential.secret() : "";
        if (!client.login(ftp.username(), password)) {
            throw ProtocolException.authentication("FTP login rejected for user " + ftp.username()
                    + " on " + ftp.host());
        }

        if (client instanceof FTPSClient) {
            FTPSClient secure = (FTPSClient) client;
            secure.execPBSZ(0);
            secure.execPROT("P");
        }

        if (ftp.passiveMode()) {
            client.enterLocalPassiveMode();
        } else {
            client.enterLocalActiveMode();
        }
    }

    private void close(FTPClient client, FtpSettings ftp) {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.logout();
        } catch (IOException e) {
            LOG.debugf("FTP logout from %s failed: %s", ftp.host(), e.getMessage());
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            LOG.debugf("FTP disconnect from %s failed: %s", ftp.host(), e.getMessage());
        }
    }

    static String normalizeDirectory(String path) {
        String dir = path == null ? "" : path.trim().replace('\\', '/');
        if (!dir.startsWith("/")) {
            dir = "/" + dir;
        }
        while (dir.length() > 1 && dir.endsWith("/")) {
            dir = dir.substring(0, dir.length() - 1);
        }
        return dir;
    }

    static String locator(FtpSettings ftp, String directory, String name) {
        String base = "ftp://" + ftp.host() + ":" + ftp.port() + directory;
        return base.endsWith("/") ? base + name : base + "/" + name;
    }
}
