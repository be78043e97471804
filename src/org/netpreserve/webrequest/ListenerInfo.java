package org.netpreserve.webrequest;

import org.netpreserve.webrequest.filter.UrlFilter;

import java.util.Objects;

public record ListenerInfo<L extends Listener>(UrlFilter filter, L listener) {
    public ListenerInfo {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(listener, "listener");
    }
}
