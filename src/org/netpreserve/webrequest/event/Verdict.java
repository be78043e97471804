package org.netpreserve.webrequest.event;

import org.netpreserve.webrequest.util.Url;

import java.net.http.HttpHeaders;
import java.util.Objects;

/**
 * Outcome of a decision-stage listener. The verdicts a stage accepts are listed in {@link EventCatalog}.
 */
public sealed interface Verdict permits Verdict.Proceed, Verdict.Cancel, Verdict.Redirect, Verdict.ModifyHeaders,
        Verdict.OverrideResponseHeaders, Verdict.RedirectUnsafe {
    Proceed PROCEED = new Proceed();
    Cancel CANCEL = new Cancel();

    /**
     * Status reported back to the network engine. Only {@link Cancel} aborts the request.
     */
    default NetError status() {
        return NetError.OK;
    }

    static Redirect redirect(String url) {
        return new Redirect(new Url(url));
    }

    static RedirectUnsafe redirectUnsafe(String url) {
        return new RedirectUnsafe(new Url(url));
    }

    /**
     * Continue unchanged.
     */
    record Proceed() implements Verdict {
    }

    /**
     * Abort the request.
     */
    record Cancel() implements Verdict {
        @Override
        public NetError status() {
            return NetError.BLOCKED_BY_CLIENT;
        }
    }

    /**
     * Send the request to a different URL instead.
     */
    record Redirect(Url url) implements Verdict {
        public Redirect {
            Objects.requireNonNull(url, "url");
        }
    }

    /**
     * Replace the outgoing request headers.
     */
    record ModifyHeaders(HttpHeaders headers) implements Verdict {
        public ModifyHeaders {
            Objects.requireNonNull(headers, "headers");
        }
    }

    /**
     * Replace the response headers seen by the rest of the pipeline.
     */
    record OverrideResponseHeaders(HttpHeaders headers) implements Verdict {
        public OverrideResponseHeaders {
            Objects.requireNonNull(headers, "headers");
        }
    }

    /**
     * Redirect to a target the network engine would otherwise refuse as unsafe.
     */
    record RedirectUnsafe(Url url) implements Verdict {
        public RedirectUnsafe {
            Objects.requireNonNull(url, "url");
        }
    }
}
