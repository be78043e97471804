package org.netpreserve.webrequest.event;

/**
 * Points in a request's processing at which a listener may be attached, in the order they fire.
 * Which stages can alter the request is defined by {@link EventCatalog}.
 */
public enum LifecycleStage {
    BEFORE_REQUEST("onBeforeRequest"),
    BEFORE_SEND_HEADERS("onBeforeSendHeaders"),
    SEND_HEADERS("onSendHeaders"),
    HEADERS_RECEIVED("onHeadersReceived"),
    BEFORE_REDIRECT("onBeforeRedirect"),
    RESPONSE_STARTED("onResponseStarted"),
    COMPLETED("onCompleted"),
    ERROR_OCCURRED("onErrorOccurred");

    private final String eventName;

    LifecycleStage(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Name of the registration method exposed to the host, e.g. {@code onBeforeRequest}.
     */
    public String eventName() {
        return eventName;
    }

    public EventCatalog.Family family() {
        return EventCatalog.entry(this).family();
    }

    public boolean isDecision() {
        return family() == EventCatalog.Family.DECISION;
    }

    public static LifecycleStage fromEventName(String eventName) {
        for (LifecycleStage stage : values()) {
            if (stage.eventName.equals(eventName)) return stage;
        }
        throw new IllegalArgumentException("Unknown web request event: " + eventName);
    }
}
