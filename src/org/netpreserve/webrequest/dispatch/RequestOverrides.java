package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.event.Verdict;
import org.netpreserve.webrequest.util.Url;

import java.net.http.HttpHeaders;

/**
 * Out-parameters of a decision stage. Owned by the network engine and only written on the request's
 * network executor. Slots stay null unless a verdict fills them.
 */
public class RequestOverrides {
    private Url newUrl;
    private HttpHeaders requestHeaders;
    private HttpHeaders responseHeaders;
    private Url allowedUnsafeRedirectUrl;

    /**
     * Replacement URL set by {@link Verdict.Redirect}.
     */
    public Url newUrl() {
        return newUrl;
    }

    /**
     * Replacement request headers set by {@link Verdict.ModifyHeaders}.
     */
    public HttpHeaders requestHeaders() {
        return requestHeaders;
    }

    /**
     * Replacement response headers set by {@link Verdict.OverrideResponseHeaders}.
     */
    public HttpHeaders responseHeaders() {
        return responseHeaders;
    }

    /**
     * Redirect target the engine should allow even though it would be refused as unsafe.
     */
    public Url allowedUnsafeRedirectUrl() {
        return allowedUnsafeRedirectUrl;
    }

    public boolean isEmpty() {
        return newUrl == null && requestHeaders == null && responseHeaders == null
               && allowedUnsafeRedirectUrl == null;
    }

    void apply(Verdict verdict) {
        if (verdict instanceof Verdict.Redirect redirect) {
            newUrl = redirect.url();
        } else if (verdict instanceof Verdict.ModifyHeaders modifyHeaders) {
            requestHeaders = modifyHeaders.headers();
        } else if (verdict instanceof Verdict.OverrideResponseHeaders override) {
            responseHeaders = override.headers();
        } else if (verdict instanceof Verdict.RedirectUnsafe redirectUnsafe) {
            allowedUnsafeRedirectUrl = redirectUnsafe.url();
        }
    }

    @Override
    public String toString() {
        return "RequestOverrides{" +
               "newUrl=" + newUrl +
               ", requestHeaders=" + requestHeaders +
               ", responseHeaders=" + responseHeaders +
               ", allowedUnsafeRedirectUrl=" + allowedUnsafeRedirectUrl +
               '}';
    }
}
