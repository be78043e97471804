package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.WebRequestException;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.util.Url;

/**
 * A decision was resolved twice, or with a verdict its stage doesn't accept.
 */
public class ProtocolViolationException extends WebRequestException {
    private final LifecycleStage stage;
    private final Url url;

    public ProtocolViolationException(LifecycleStage stage, Url url, String message) {
        super(stage.eventName() + ": " + message + " for " + url);
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
