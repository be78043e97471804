package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.WebRequestException;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.util.Url;

/**
 * A listener threw or produced something that could not be turned into a verdict.
 */
public class HandlerFaultException extends WebRequestException {
    private final LifecycleStage stage;
    private final Url url;

    public HandlerFaultException(LifecycleStage stage, Url url, Throwable cause) {
        super(stage.eventName() + " listener failed for " + url, cause);
        this.stage = stage;
        this.url = url;
    }

    public LifecycleStage stage() {
        return stage;
    }

    public Url url() {
        return url;
    }
}
