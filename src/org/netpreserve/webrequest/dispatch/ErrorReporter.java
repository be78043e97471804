package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.WebRequestException;

/**
 * Receives errors that happen during dispatch. They are never thrown back into the network engine.
 */
@FunctionalInterface
public interface ErrorReporter {
    void report(WebRequestException e);
}
