package com.lbg.markets.surveillance.discovery.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.discovery.domain.BlobSettings;
import com.lbg.markets.surveillance.discovery.domain.FtpSettings;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.ProtocolSettings;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.domain.WebAuthMode;
import com.lbg.markets.surveillance.discovery.domain.WebSettings;
import com.lbg.markets.surveillance.discovery.schedule.ScheduleEvaluator;
import com.lbg.markets.surveillance.discovery.util.TokenResolver;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Creation-time checks on a retrieval configuration. All problems are collected
 * and reported together in one {@link ValidationException}.
 */
@ApplicationScoped
public class ConfigurationValidator {

    public static final int MAX_TENANT_ID = 50;
    public static final int MAX_CONFIGURATION_ID = 100;
    public static final int MAX_NAME = 200;
    public static final int MAX_DESCRIPTION = 1000;
    public static final int MAX_PATH_PATTERN = 500;
    public static final int MAX_NAME_PATTERN = 200;
    public static final int MAX_EXTENSION = 10;
    public static final int MAX_TYPE_NAME = 200;
    public static final int MAX_PAYLOAD_BYTES = 10 * 1024;
    public static final int MAX_HOST = 255;
    public static final int MAX_USERNAME = 100;
    public static final int MAX_BASE_URL = 500;
    public static final int MAX_BLOB_PREFIX = 1024;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final Pattern EXTENSION = Pattern.compile("\\.?[A-Za-z0-9]+");
    private static final Pattern ACCOUNT_NAME = Pattern.compile("[a-z0-9]{3,24}");
    private static final Pattern CONTAINER_NAME = Pattern.compile("[a-z0-9](?:[a-z0-9]|-(?=[a-z0-9])){2,62}");
    private static final Pattern FORBIDDEN_PATH_CHARS = Pattern.compile("[\\p{Cntrl}<>\"|]");

    private final ScheduleEvaluator scheduleEvaluator;
    private final ObjectMapper objectMapper;
    private final boolean allowPlainHttp;

    public ConfigurationValidator(
            ScheduleEvaluator scheduleEvaluator,
            ObjectMapper objectMapper,
            @ConfigProperty(name = "discovery.web.allow-plain-http", defaultValue = "false") boolean allowPlainHttp
    ) {
        this.scheduleEvaluator = scheduleEvaluator;
        this.objectMapper = objectMapper;
        this.allowPlainHttp = allowPlainHttp;
    }

    public void validate(RetrievalConfiguration config) {
        List<String> errors = new ArrayList<>();

        checkIdentifier(errors, "tenantId", config.tenantId(), MAX_TENANT_ID);
        checkIdentifier(errors, "configurationId", config.configurationId(), MAX_CONFIGURATION_ID);
        checkLength(errors, "name", config.name(), MAX_NAME);
        checkLength(errors, "description", config.description(), MAX_DESCRIPTION);

        checkPattern(errors, "pathPattern", config.pathPattern(), MAX_PATH_PATTERN);
        checkPattern(errors, "namePattern", config.namePattern(), MAX_NAME_PATTERN);
        if (config.namePattern().contains("/")) {
            errors.add("namePattern must not contain '/'");
        }
        if (config.extension() != null && !config.extension().isBlank()) {
            if (config.extension().length() > MAX_EXTENSION || !EXTENSION.matcher(config.extension()).matches()) {
                errors.add("extension must be up to " + MAX_EXTENSION + " letters or digits");
            }
        }

        errors.addAll(scheduleEvaluator.validate(config.schedule().cronExpression(), config.schedule().zoneId()));

        if (config.settings().protocol() != config.protocol()) {
            errors.add("settings type " + config.settings().protocol() + " does not match protocol " + config.protocol());
        } else {
            checkSettings(errors, config.settings());
        }

        if (config.targets().isEmpty()) {
            errors.add("at least one notification target is required");
        }
        for (int i = 0; i < config.targets().size(); i++) {
            checkTarget(errors, i, config.targets().get(i));
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void checkSettings(List<String> errors, ProtocolSettings settings) {
        switch (settings.protocol()) {
            case FTP:
                checkFtp(errors, (FtpSettings) settings);
                break;
            case WEB:
                checkWeb(errors, (WebSettings) settings);
                break;
            case BLOB_STORE:
                checkBlob(errors, (BlobSettings) settings);
                break;
            default:
                errors.add("unsupported protocol " + settings.protocol());
        }
    }

    private void checkFtp(List<String> errors, FtpSettings ftp) {
        checkLength(errors, "ftp.host", ftp.host(), MAX_HOST);
        if (ftp.host().contains("{")) {
            errors.add("ftp.host must not contain tokens");
        }
        if (ftp.host().contains("/") || ftp.host().contains(":")) {
            errors.add("ftp.host must be a bare host name");
        }
        checkLength(errors, "ftp.username", ftp.username(), MAX_USERNAME);
    }

    private void checkWeb(List<String> errors, WebSettings web) {
        checkLength(errors, "web.baseUrl", web.baseUrl(), MAX_BASE_URL);
        try {
            URI uri = new URI(web.baseUrl());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
            boolean schemeOk = "https".equals(scheme) || (allowPlainHttp && "http".equals(scheme));
            if (!schemeOk) {
                errors.add("web.baseUrl must use https");
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                errors.add("web.baseUrl must name a host");
            }
        } catch (URISyntaxException e) {
            errors.add("web.baseUrl is not a valid URL: " + e.getReason());
        }
        if (web.baseUrl().contains("{")) {
            errors.add("web.baseUrl must not contain tokens; put them in the path pattern");
        }
        if (web.authMode() != WebAuthMode.NONE && isBlank(web.credentialHandle())) {
            errors.add("web.credentialHandle is required for " + web.authMode() + " authentication");
        }
        if (web.authMode() == WebAuthMode.BASIC && isBlank(web.username())) {
            errors.add("web.username is required for BASIC authentication");
        }
    }

    private void checkBlob(List<String> errors, BlobSettings blob) {
        if (!ACCOUNT_NAME.matcher(blob.accountName()).matches()) {
            errors.add("blob.accountName must be 3-24 lowercase letters or digits");
        }
        if (!CONTAINER_NAME.matcher(blob.containerName()).matches()) {
            errors.add("blob.containerName must be 3-63 lowercase letters, digits or single hyphens");
        }
        checkLength(errors, "blob.blobPrefix", blob.blobPrefix(), MAX_BLOB_PREFIX);
        if (isBlank(blob.credentialHandle())) {
            errors.add("blob.credentialHandle is required");
        }
    }

    private void checkTarget(List<String> errors, int index, NotificationTarget target) {
        String field = "targets[" + index + "]";
        checkLength(errors, field + ".typeName", target.typeName(), MAX_TYPE_NAME);
        checkLength(errors, field + ".destination", target.destination(), MAX_TYPE_NAME);
        try {
            int size = objectMapper.writeValueAsString(target.payload()).getBytes(StandardCharsets.UTF_8).length;
            if (size > MAX_PAYLOAD_BYTES) {
                errors.add(field + ".payload is " + size + " bytes, limit is " + MAX_PAYLOAD_BYTES);
            }
        } catch (JsonProcessingException e) {
            errors.add(field + ".payload is not serialisable: " + e.getOriginalMessage());
        }
    }

    private static void checkIdentifier(List<String> errors, String field, String value, int max) {
        checkLength(errors, field, value, max);
        if (!IDENTIFIER.matcher(value).matches()) {
            errors.add(field + " may only contain letters, digits, '.', '_' and '-'");
        }
    }

    private static void checkPattern(List<String> errors, String field, String value, int max) {
        checkLength(errors, field, value, max);
        if (FORBIDDEN_PATH_CHARS.matcher(value).find()) {
            errors.add(field + " contains control or reserved characters");
        }
        List<String> unknown = TokenResolver.unknownTokens(value);
        if (!unknown.isEmpty()) {
            errors.add(field + " has unsupported tokens " + unknown + "; use {yyyy}, {yy}, {mm} or {dd}");
        }
    }

    private static void checkLength(List<String> errors, String field, String value, int max) {
        if (value != null && value.length() > max) {
            errors.add(field + " exceeds " + max + " characters");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
