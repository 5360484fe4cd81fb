package com.ctdl.scout.service.download;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hands out one distinct file name per link inside a target directory.
 * <p>
 * The name is the last path segment of the URL. Links without a usable segment get
 * {@code <host>-<sha1 prefix>}. A name that is already on disk or already handed out
 * gets {@code -1}, {@code -2}, ... before its extension.
 */
public class FileNameResolver {

    private static final int MAX_NAME_LENGTH = 200;
    private static final Pattern STRAY_PERCENT = Pattern.compile("%(?![0-9A-Fa-f]{2})");

    /** Names reserved by transfers still in flight. Saved files are guarded by {@link Files#exists}. */
    private final Set<Path> claimed = new HashSet<>();

    public synchronized Path claim(Path directory, String url) {
        String name = deriveName(url);
        Path candidate = directory.resolve(name);
        int suffix = 1;
        while (claimed.contains(candidate) || Files.exists(candidate)) {
            candidate = directory.resolve(withSuffix(name, suffix++));
        }
        claimed.add(candidate);
        return candidate;
    }

    /**
     * Frees a name once its transfer is over: either the file now exists or it was never written.
     */
    public synchronized void release(Path file) {
        claimed.remove(file);
    }

    static String deriveName(String url) {
        String path = "";
        String host = "download";
        try {
            URI uri = URI.create(url);
            if (uri.getRawPath() != null) {
                path = uri.getRawPath();
            }
            if (uri.getHost() != null) {
                host = uri.getHost();
            }
        } catch (IllegalArgumentException e) {
            int query = url.indexOf('?');
            path = query >= 0 ? url.substring(0, query) : url;
        }

        String segment = path.substring(path.lastIndexOf('/') + 1);
        String name = sanitize(decode(segment));
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
            return sanitize(host) + "-" + shortHash(url);
        }
        return name.length() > MAX_NAME_LENGTH ? name.substring(name.length() - MAX_NAME_LENGTH) : name;
    }

    /**
     * Percent-decodes a path segment. A {@code %} that does not start a valid escape stays literal,
     * and {@code +} is not a space in a path.
     */
    static String decode(String segment) {
        String escaped = STRAY_PERCENT.matcher(segment).replaceAll("%25").replace("+", "%2B");
        return URLDecoder.decode(escaped, StandardCharsets.UTF_8);
    }

    private static String sanitize(String value) {
        return value.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
    }

    private static String withSuffix(String name, int suffix) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return name + "-" + suffix;
        }
        return name.substring(0, dot) + "-" + suffix + name.substring(dot);
    }

    private static String shortHash(String url) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
