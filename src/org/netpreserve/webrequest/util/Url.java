package org.netpreserve.webrequest.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.urlcanon.ParsedUrl;

import java.util.Locale;
import java.util.Objects;

/**
 * URL type which caches parsing. Parsing is lenient, so characters browsers leave unescaped such as
 * {@code |} or {@code {}} don't make a URL unparseable.
 */
public class Url {
    private final String url;
    private ParsedUrl parsedUrl;

    @JsonCreator
    public Url(String url) {
        this.url = Objects.requireNonNull(url);
    }

    private synchronized ParsedUrl parse() {
        if (parsedUrl == null) {
            parsedUrl = ParsedUrl.parseUrl(url);
        }
        return parsedUrl;
    }

    public @Nullable String scheme() {
        String scheme = parse().getScheme();
        if (scheme == null || scheme.isEmpty()) return null;
        return scheme.toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cased host with IPv6 brackets kept, or null for hostless URLs.
     */
    public @Nullable String host() {
        String host = parse().getHost();
        if (host == null || host.isEmpty()) return null;
        return host.toLowerCase(Locale.ROOT);
    }

    /**
     * The explicit port, or the default port of the scheme, or -1 if neither is known.
     */
    public int port() {
        String port = parse().getPort();
        if (port != null && !port.isEmpty()) {
            try {
                return Integer.parseInt(port);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        String scheme = scheme();
        if (scheme == null) return -1;
        return switch (scheme) {
            case "http", "ws" -> 80;
            case "https", "wss" -> 443;
            case "ftp" -> 21;
            default -> -1;
        };
    }

    /**
     * Path and query as they appear in the URL. URLs with a host but an empty path report "/".
     */
    public @Nullable String pathAndQuery() {
        ParsedUrl parsed = parse();
        if (scheme() == null) return null;
        String path = parsed.getPath();
        if (path.isEmpty() && host() != null) path = "/";
        return path + parsed.getQuestionMark() + parsed.getQuery();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
