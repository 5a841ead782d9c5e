package com.intelhub.backend.ingestion;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Identity of a source record: SHA-256 of the canonical source URL, or of the normalized content
 * when the record has no usable URL.
 */
@Slf4j
@Component
public class FingerprintPolicy {

    private static final Set<String> TRACKING_PARAMS = Set.of("fbclid", "gclid", "spm", "mc_cid", "mc_eid");

    public String fingerprint(String sourceUrl, String content) {
        String canonicalUrl = canonicalizeUrl(sourceUrl);
        if (canonicalUrl != null) {
            return sha256("url:" + canonicalUrl);
        }
        return sha256("content:" + normalizeContent(content));
    }

    /**
     * @return the canonical form, or null when the value is not an absolute http(s) URL
     */
    public String canonicalizeUrl(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(sourceUrl.trim());
        } catch (URISyntaxException e) {
            log.debug("Source reference is not a URI, falling back to content hash: {}", sourceUrl);
            return null;
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        if (uri.getHost() == null || !("http".equals(scheme) || "https".equals(scheme))) {
            return null;
        }

        StringBuilder canonical = new StringBuilder()
                .append(scheme).append("://")
                .append(uri.getHost().toLowerCase(Locale.ROOT));

        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
        if (!defaultPort) {
            canonical.append(':').append(port);
        }

        String path = uri.getRawPath() != null ? uri.getRawPath() : "";
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        canonical.append(path);

        String query = canonicalQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            canonical.append('?').append(query);
        }
        return canonical.toString();
    }

    public String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        return content.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        return Arrays.stream(rawQuery.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String name = param.split("=", 2)[0].toLowerCase(Locale.ROOT);
                    return !name.startsWith("utm_") && !TRACKING_PARAMS.contains(name);
                })
                .sorted()
                .collect(Collectors.joining("&"));
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
