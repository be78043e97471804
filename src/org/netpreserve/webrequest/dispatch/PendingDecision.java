package org.netpreserve.webrequest.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.netpreserve.webrequest.DecisionCallback;
import org.netpreserve.webrequest.event.EventCatalog;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.event.ListenerResponse;
import org.netpreserve.webrequest.event.Verdict;
import org.netpreserve.webrequest.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A decision-stage request held while its listener decides. Resolves at most once: the first verdict is applied
 * to the request's {@link RequestOverrides} on its network executor and then completes {@link #future()}.
 * Later resolutions are reported as {@link ProtocolViolationException} and ignored. If the owning registry is
 * destroyed first the decision is abandoned and completes with {@link Verdict#PROCEED} straight away.
 */
public class PendingDecision implements DecisionCallback {
    private static final Logger log = LoggerFactory.getLogger(PendingDecision.class);
    private final LifecycleStage stage;
    private final RequestInfo request;
    private final RequestOverrides overrides;
    private final ErrorReporter errorReporter;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private final CompletableFuture<Verdict> future = new CompletableFuture<>();
    private final long createdNanos = System.nanoTime();

    enum State {
        PENDING, RESOLVED, ABANDONED
    }

    PendingDecision(LifecycleStage stage, RequestInfo request, RequestOverrides overrides,
                    ErrorReporter errorReporter) {
        if (!EventCatalog.entry(stage).family().equals(EventCatalog.Family.DECISION)) {
            throw new IllegalArgumentException(stage + " is not a decision stage");
        }
        this.stage = stage;
        this.request = request;
        this.overrides = overrides;
        this.errorReporter = errorReporter;
    }

    @Override
    public LifecycleStage stage() {
        return stage;
    }

    public RequestInfo request() {
        return request;
    }

    public CompletableFuture<Verdict> future() {
        return future;
    }

    public boolean isDone() {
        return state.get() != State.PENDING;
    }

    long ageNanos() {
        return System.nanoTime() - createdNanos;
    }

    @Override
    public boolean resolve(Verdict verdict) {
        Objects.requireNonNull(verdict, "verdict");
        if (!state.compareAndSet(State.PENDING, State.RESOLVED)) {
            if (state.get() == State.ABANDONED) {
                log.debug("Ignoring {} for {} after its context was destroyed", verdict, request.url());
            } else {
                errorReporter.report(new ProtocolViolationException(stage, request.url(),
                        "decision already resolved, ignoring " + verdict));
            }
            return false;
        }
        if (!EventCatalog.entry(stage).allows(verdict)) {
            apply(Verdict.PROCEED);
            errorReporter.report(new ProtocolViolationException(stage, request.url(),
                    verdict + " is not allowed, proceeding unchanged"));
            return true;
        }
        apply(verdict);
        return true;
    }

    @Override
    public boolean resolve(JsonNode response) {
        Verdict verdict;
        try {
            ListenerResponse listenerResponse = Json.MAPPER.treeToValue(response, ListenerResponse.class);
            verdict = listenerResponse == null ? Verdict.PROCEED : listenerResponse.toVerdict(stage);
        } catch (JsonProcessingException | RuntimeException e) {
            boolean resolved = failOpen();
            errorReporter.report(new HandlerFaultException(stage, request.url(), e));
            return resolved;
        }
        return resolve(verdict);
    }

    /**
     * Resolves with {@link Verdict#PROCEED} unless already resolved. Used when the listener failed, so a
     * failure after a successful resolve is not reported as a second resolution.
     */
    boolean failOpen() {
        if (!state.compareAndSet(State.PENDING, State.RESOLVED)) return false;
        apply(Verdict.PROCEED);
        return true;
    }

    /**
     * Completes with {@link Verdict#PROCEED} on the calling thread without touching the overrides.
     *
     * @return false if the decision was already resolved
     */
    public boolean abandon() {
        if (!state.compareAndSet(State.PENDING, State.ABANDONED)) return false;
        future.complete(Verdict.PROCEED);
        return true;
    }

    private void apply(Verdict verdict) {
        try {
            request.networkExecutor().execute(() -> {
                overrides.apply(verdict);
                future.complete(verdict);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Network executor rejected {} for {}, proceeding unchanged", verdict, request.url(), e);
            future.complete(Verdict.PROCEED);
        }
    }

    @Override
    public String toString() {
        return "PendingDecision{" + stage.eventName() + " " + request.url() + " " + state.get() + "}";
    }
}
