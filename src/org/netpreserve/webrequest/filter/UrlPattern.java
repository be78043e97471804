package org.netpreserve.webrequest.filter;

import org.netpreserve.webrequest.util.Url;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A single compiled match pattern of the form {@code <scheme>://<host><path>} or {@code <all_urls>}.
 * <ul>
 *   <li>scheme: {@code *} (any of http, https, ws, wss) or one of {@link #KNOWN_SCHEMES}</li>
 *   <li>host: {@code *}, {@code *.example.org} (the domain and its subdomains) or a literal host,
 *       optionally followed by {@code :port} or {@code :*}. No port means any port.</li>
 *   <li>path: starts with {@code /}, {@code *} matches any run of characters. Matched against path and query.</li>
 * </ul>
 * Instances are immutable.
 */
public final class UrlPattern {
    public static final String ALL_URLS = "<all_urls>";
    public static final Set<String> KNOWN_SCHEMES = Set.of("http", "https", "ws", "wss", "ftp", "file", "data",
            "urn", "filesystem", "chrome", "chrome-extension");
    static final Set<String> WILDCARD_SCHEMES = Set.of("http", "https", "ws", "wss");
    private static final String ANY_PORT = "*";

    private final String pattern;
    private final boolean matchAllUrls;
    private final String scheme;
    private final String host;
    private final boolean matchSubdomains;
    private final String port;
    private final Pattern path;

    private UrlPattern(String pattern, boolean matchAllUrls, String scheme, String host,
                       boolean matchSubdomains, String port, Pattern path) {
        this.pattern = pattern;
        this.matchAllUrls = matchAllUrls;
        this.scheme = scheme;
        this.host = host;
        this.matchSubdomains = matchSubdomains;
        this.port = port;
        this.path = path;
    }

    public static UrlPattern parse(String pattern) {
        if (pattern == null) throw new InvalidPatternException("null", "Pattern must be a string");
        if (pattern.equals(ALL_URLS)) {
            return new UrlPattern(pattern, true, null, "", true, ANY_PORT, null);
        }

        int schemeEnd = pattern.indexOf("://");
        if (schemeEnd == -1) throw new InvalidPatternException(pattern, "Missing scheme separator");
        String scheme = pattern.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        if (!scheme.equals("*") && !KNOWN_SCHEMES.contains(scheme)) {
            throw new InvalidPatternException(pattern, "Invalid scheme");
        }

        String rest = pattern.substring(schemeEnd + 3);
        int pathStart = rest.indexOf('/');
        if (pathStart == -1) throw new InvalidPatternException(pattern, "Missing path");
        String authority = rest.substring(0, pathStart);
        Pattern path = compileGlob(rest.substring(pathStart));

        if (scheme.equals("file")) {
            if (!authority.isEmpty() && !authority.equalsIgnoreCase("localhost")) {
                throw new InvalidPatternException(pattern, "Invalid host");
            }
            return new UrlPattern(pattern, false, scheme, "", true, ANY_PORT, path);
        }

        String host = authority;
        String port = ANY_PORT;
        int portSep = authority.lastIndexOf(':');
        if (portSep != -1 && portSep > authority.lastIndexOf(']')) {
            port = authority.substring(portSep + 1);
            host = authority.substring(0, portSep);
            if (!isValidPort(port)) throw new InvalidPatternException(pattern, "Invalid port");
        }

        if (host.isEmpty()) throw new InvalidPatternException(pattern, "Empty host");
        boolean matchSubdomains = false;
        if (host.equals("*")) {
            host = "";
            matchSubdomains = true;
        } else if (host.startsWith("*.")) {
            host = host.substring(2);
            matchSubdomains = true;
        }
        if (host.contains("*")) throw new InvalidPatternException(pattern, "Invalid host wildcard");

        return new UrlPattern(pattern, false, scheme.equals("*") ? null : scheme,
                host.toLowerCase(Locale.ROOT), matchSubdomains, port, path);
    }

    private static boolean isValidPort(String port) {
        if (port.equals(ANY_PORT)) return true;
        if (port.isEmpty() || port.length() > 5) return false;
        for (int i = 0; i < port.length(); i++) {
            if (!Character.isDigit(port.charAt(i))) return false;
        }
        return Integer.parseInt(port) <= 65535;
    }

    private static Pattern compileGlob(String glob) {
        var regex = new StringBuilder();
        int start = 0;
        for (int i = glob.indexOf('*'); i != -1; i = glob.indexOf('*', start)) {
            if (i > start) regex.append(Pattern.quote(glob.substring(start, i)));
            regex.append(".*");
            start = i + 1;
        }
        if (start < glob.length()) regex.append(Pattern.quote(glob.substring(start)));
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    public boolean matches(Url url) {
        String urlScheme = url.scheme();
        if (urlScheme == null) return false;
        if (matchAllUrls) return KNOWN_SCHEMES.contains(urlScheme);
        if (scheme == null ? !WILDCARD_SCHEMES.contains(urlScheme) : !scheme.equals(urlScheme)) return false;
        if (!urlScheme.equals("file") && !(matchesHost(url.host()) && matchesPort(url.port()))) return false;
        String pathAndQuery = url.pathAndQuery();
        return pathAndQuery != null && path.matcher(pathAndQuery).matches();
    }

    private boolean matchesHost(String urlHost) {
        if (urlHost == null) return false;
        if (host.isEmpty()) return true;
        if (urlHost.equals(host)) return true;
        return matchSubdomains && urlHost.endsWith("." + host);
    }

    private boolean matchesPort(int urlPort) {
        return port.equals(ANY_PORT) || Integer.parseInt(port) == urlPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return pattern.equals(((UrlPattern) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
