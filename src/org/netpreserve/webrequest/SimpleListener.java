package org.netpreserve.webrequest;

import org.netpreserve.webrequest.event.RequestDetails;

@FunctionalInterface
public non-sealed interface SimpleListener extends Listener {
    void handle(RequestDetails details);
}
