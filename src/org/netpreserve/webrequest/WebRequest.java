package org.netpreserve.webrequest;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.webrequest.dispatch.PendingDecision;
import org.netpreserve.webrequest.event.EventCatalog;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import static org.netpreserve.webrequest.event.LifecycleStage.*;

/**
 * The listeners registered for one owning context. Each stage holds at most one listener; setting a new one
 * replaces the previous one and passing {@code null} removes it. Obtained from {@link ContextRegistry}.
 */
public class WebRequest {
    private static final Logger log = LoggerFactory.getLogger(WebRequest.class);
    private final Object context;
    private final Executor listenerExecutor;
    private final Map<LifecycleStage, ListenerInfo<SimpleListener>> simpleListeners = new ConcurrentHashMap<>();
    private final Map<LifecycleStage, ListenerInfo<ResponseListener>> responseListeners = new ConcurrentHashMap<>();
    private final Set<PendingDecision> pendingDecisions = ConcurrentHashMap.newKeySet();
    private volatile boolean destroyed;

    WebRequest(Object context, Executor listenerExecutor) {
        this.context = context;
        this.listenerExecutor = listenerExecutor;
    }

    public void onBeforeRequest(FilterSpec filter, @Nullable ResponseListener listener) {
        set(BEFORE_REQUEST, filter, listener);
    }

    public void onBeforeSendHeaders(FilterSpec filter, @Nullable ResponseListener listener) {
        set(BEFORE_SEND_HEADERS, filter, listener);
    }

    public void onHeadersReceived(FilterSpec filter, @Nullable ResponseListener listener) {
        set(HEADERS_RECEIVED, filter, listener);
    }

    public void onSendHeaders(FilterSpec filter, @Nullable SimpleListener listener) {
        set(SEND_HEADERS, filter, listener);
    }

    public void onBeforeRedirect(FilterSpec filter, @Nullable SimpleListener listener) {
        set(BEFORE_REDIRECT, filter, listener);
    }

    public void onResponseStarted(FilterSpec filter, @Nullable SimpleListener listener) {
        set(RESPONSE_STARTED, filter, listener);
    }

    public void onErrorOccurred(FilterSpec filter, @Nullable SimpleListener listener) {
        set(ERROR_OCCURRED, filter, listener);
    }

    public void onCompleted(FilterSpec filter, @Nullable SimpleListener listener) {
        set(COMPLETED, filter, listener);
    }

    /**
     * Registers {@code listener} for {@code stage}, replacing any existing one. A null listener clears the stage.
     *
     * @throws org.netpreserve.webrequest.filter.InvalidPatternException if the filter has a malformed pattern
     * @throws IllegalArgumentException if the listener kind doesn't match the stage
     */
    public void set(LifecycleStage stage, @Nullable FilterSpec filterSpec, @Nullable Listener listener) {
        if (listener == null) {
            clear(stage);
            return;
        }
        var filter = (filterSpec == null ? FilterSpec.ALL : filterSpec).compile();
        switch (EventCatalog.entry(stage).family()) {
            case SIMPLE -> {
                if (!(listener instanceof SimpleListener simpleListener)) {
                    throw new IllegalArgumentException(stage.eventName() + " takes a SimpleListener");
                }
                simpleListeners.put(stage, new ListenerInfo<>(filter, simpleListener));
            }
            case DECISION -> {
                if (!(listener instanceof ResponseListener responseListener)) {
                    throw new IllegalArgumentException(stage.eventName() + " takes a ResponseListener");
                }
                responseListeners.put(stage, new ListenerInfo<>(filter, responseListener));
            }
        }
        log.debug("Set {} listener for {} with filter {}", stage.eventName(), context, filter);
    }

    public void clear(LifecycleStage stage) {
        if (simpleListeners.remove(stage) != null || responseListeners.remove(stage) != null) {
            log.debug("Cleared {} listener for {}", stage.eventName(), context);
        }
    }

    public @Nullable ListenerInfo<? extends Listener> get(LifecycleStage stage) {
        var info = simpleListeners.get(stage);
        return info != null ? info : responseListeners.get(stage);
    }

    public @Nullable ListenerInfo<SimpleListener> simpleListener(LifecycleStage stage) {
        return simpleListeners.get(stage);
    }

    public @Nullable ListenerInfo<ResponseListener> responseListener(LifecycleStage stage) {
        return responseListeners.get(stage);
    }

    public Object context() {
        return context;
    }

    public Executor listenerExecutor() {
        return listenerExecutor;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public int pendingCount() {
        return pendingDecisions.size();
    }

    /**
     * Tracks a decision so that teardown can release it.
     *
     * @return false if this registry has already been destroyed, in which case the caller must abandon it
     */
    public boolean track(PendingDecision decision) {
        pendingDecisions.add(decision);
        if (destroyed) {
            pendingDecisions.remove(decision);
            return false;
        }
        decision.future().whenComplete((verdict, t) -> pendingDecisions.remove(decision));
        return true;
    }

    /**
     * Drops every listener and releases held requests with {@link org.netpreserve.webrequest.event.Verdict#PROCEED}.
     */
    void destroy() {
        destroyed = true;
        simpleListeners.clear();
        responseListeners.clear();
        int abandoned = 0;
        for (var decision : pendingDecisions) {
            if (decision.abandon()) abandoned++;
        }
        pendingDecisions.clear();
        log.debug("Destroyed WebRequest for {}, released {} pending decisions", context, abandoned);
    }
}
