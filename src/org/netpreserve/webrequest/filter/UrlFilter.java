package org.netpreserve.webrequest.filter;

import org.netpreserve.webrequest.util.Url;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A set of compiled {@link UrlPattern}s. An empty filter matches every URL, a non-empty filter matches a URL
 * if any of its patterns does. Immutable once compiled.
 */
public final class UrlFilter {
    public static final UrlFilter ALL = new UrlFilter(List.of());

    private final List<UrlPattern> patterns;

    private UrlFilter(List<UrlPattern> patterns) {
        this.patterns = patterns;
    }

    /**
     * Compiles every pattern. Fails as a whole on the first malformed pattern.
     *
     * @throws InvalidPatternException if any pattern does not parse
     */
    public static UrlFilter compile(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) return ALL;
        var compiled = new ArrayList<UrlPattern>(patterns.size());
        for (String pattern : new LinkedHashSet<>(patterns)) {
            compiled.add(UrlPattern.parse(pattern));
        }
        return new UrlFilter(List.copyOf(compiled));
    }

    public static UrlFilter compile(String... patterns) {
        return compile(Arrays.asList(patterns));
    }

    public boolean matches(Url url) {
        if (patterns.isEmpty()) return true;
        for (var pattern : patterns) {
            if (pattern.matches(url)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public List<UrlPattern> patterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return patterns.isEmpty() ? "[*]" : patterns.toString();
    }
}
