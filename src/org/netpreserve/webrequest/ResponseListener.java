package org.netpreserve.webrequest;

import org.netpreserve.webrequest.event.RequestDetails;

/**
 * Listener for a decision stage. The request stays on hold until {@code callback} is resolved, which may
 * happen after this method returns and from any thread.
 */
@FunctionalInterface
public non-sealed interface ResponseListener extends Listener {
    void handle(RequestDetails details, DecisionCallback callback);
}
