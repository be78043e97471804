package org.netpreserve.webrequest.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.netpreserve.webrequest.util.Url;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * Response object a host-side listener passes to its callback, e.g.
 * {@code {"cancel": true}} or {@code {"redirectURL": "https://example.org/"}}.
 * Fields that don't apply to the stage are ignored.
 */
public record ListenerResponse(
        Boolean cancel,
        @JsonProperty("redirectURL") String redirectUrl,
        Map<String, List<String>> requestHeaders,
        Map<String, List<String>> responseHeaders
) {
    public Verdict toVerdict(LifecycleStage stage) {
        if (Boolean.TRUE.equals(cancel)) return Verdict.CANCEL;
        switch (stage) {
            case BEFORE_REQUEST -> {
                if (redirectUrl != null) return new Verdict.Redirect(new Url(redirectUrl));
            }
            case BEFORE_SEND_HEADERS -> {
                if (requestHeaders != null) return new Verdict.ModifyHeaders(toHeaders(requestHeaders));
            }
            case HEADERS_RECEIVED -> {
                if (responseHeaders != null) return new Verdict.OverrideResponseHeaders(toHeaders(responseHeaders));
                if (redirectUrl != null) return new Verdict.RedirectUnsafe(new Url(redirectUrl));
            }
            default -> throw new IllegalArgumentException(stage + " does not take a response");
        }
        return Verdict.PROCEED;
    }

    static HttpHeaders toHeaders(Map<String, List<String>> headers) {
        return HttpHeaders.of(headers, (name, value) -> value != null);
    }
}
