package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.event.RequestDetails;
import org.netpreserve.webrequest.util.Url;

import java.net.http.HttpHeaders;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Snapshot of a request supplied by the network engine for one dispatch.
 *
 * @param context         the owning context whose {@link org.netpreserve.webrequest.WebRequest} applies
 * @param networkExecutor where the request's {@link RequestOverrides} may be written and the engine resumed
 */
public record RequestInfo(
        long id,
        Url url,
        String method,
        String resourceType,
        Object context,
        HttpHeaders requestHeaders,
        HttpHeaders responseHeaders,
        Integer statusCode,
        Executor networkExecutor
) {
    private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (name, value) -> true);

    public RequestInfo {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(context, "context");
        if (method == null) method = "GET";
        if (resourceType == null) resourceType = "other";
        if (requestHeaders == null) requestHeaders = NO_HEADERS;
        if (responseHeaders == null) responseHeaders = NO_HEADERS;
        if (networkExecutor == null) networkExecutor = Runnable::run;
    }

    public static Builder builder(Object context, String url) {
        return new Builder(context, new Url(url));
    }

    RequestDetails toDetails() {
        return new RequestDetails(id, url, method, resourceType);
    }

    public static class Builder {
        private long id;
        private final Object context;
        private final Url url;
        private String method;
        private String resourceType;
        private HttpHeaders requestHeaders;
        private HttpHeaders responseHeaders;
        private Integer statusCode;
        private Executor networkExecutor;

        private Builder(Object context, Url url) {
            this.context = context;
            this.url = url;
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder requestHeaders(HttpHeaders requestHeaders) {
            this.requestHeaders = requestHeaders;
            return this;
        }

        public Builder response(int statusCode, HttpHeaders responseHeaders) {
            this.statusCode = statusCode;
            this.responseHeaders = responseHeaders;
            return this;
        }

        public Builder networkExecutor(Executor networkExecutor) {
            this.networkExecutor = networkExecutor;
            return this;
        }

        public RequestInfo build() {
            return new RequestInfo(id, url, method, resourceType, context, requestHeaders, responseHeaders,
                    statusCode, networkExecutor);
        }
    }
}
