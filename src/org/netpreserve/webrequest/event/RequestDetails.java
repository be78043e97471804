package org.netpreserve.webrequest.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.netpreserve.webrequest.util.Url;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a request handed to listeners. Fields a stage doesn't carry are null and are
 * left out when serialized for the host.
 *
 * @param timestamp   milliseconds since the epoch at dispatch time
 * @param redirectUrl new location, for {@link LifecycleStage#BEFORE_REDIRECT}
 * @param error       error text, for {@link LifecycleStage#ERROR_OCCURRED} and failed completions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestDetails(
        long id,
        Url url,
        String method,
        String resourceType,
        double timestamp,
        Map<String, List<String>> requestHeaders,
        Map<String, List<String>> responseHeaders,
        Integer statusCode,
        @JsonProperty("redirectURL") Url redirectUrl,
        String error
) {
    public RequestDetails(long id, Url url, String method, String resourceType) {
        this(id, url, method, resourceType, System.currentTimeMillis(), null, null, null, null, null);
    }

    public RequestDetails withRequestHeaders(HttpHeaders headers) {
        return new RequestDetails(id, url, method, resourceType, timestamp, headers == null ? null : headers.map(),
                responseHeaders, statusCode, redirectUrl, error);
    }

    public RequestDetails withResponse(Integer statusCode, HttpHeaders headers) {
        return new RequestDetails(id, url, method, resourceType, timestamp, requestHeaders,
                headers == null ? null : headers.map(), statusCode, redirectUrl, error);
    }

    public RequestDetails withRedirectUrl(Url redirectUrl) {
        return new RequestDetails(id, url, method, resourceType, timestamp, requestHeaders, responseHeaders,
                statusCode, redirectUrl, error);
    }

    public RequestDetails withError(NetError error) {
        return new RequestDetails(id, url, method, resourceType, timestamp, requestHeaders, responseHeaders,
                statusCode, redirectUrl, error == null ? null : error.errorText());
    }
}
