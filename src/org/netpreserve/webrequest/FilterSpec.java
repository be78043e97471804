package org.netpreserve.webrequest;

import org.netpreserve.webrequest.filter.UrlFilter;

import java.util.List;

/**
 * Filter argument of a listener registration, bound from {@code {"urls": [...]}}.
 * Leaving out {@code urls} matches every request.
 */
public record FilterSpec(List<String> urls) {
    public static final FilterSpec ALL = new FilterSpec(null);

    public static FilterSpec urls(String... urls) {
        return new FilterSpec(List.of(urls));
    }

    /**
     * @throws org.netpreserve.webrequest.filter.InvalidPatternException if any pattern is malformed
     */
    public UrlFilter compile() {
        return urls == null ? UrlFilter.ALL : UrlFilter.compile(urls);
    }
}
