package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.ContextRegistry;
import org.netpreserve.webrequest.WebRequest;
import org.netpreserve.webrequest.config.WebRequestConfig;
import org.netpreserve.webrequest.event.EventCatalog;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.event.NetError;
import org.netpreserve.webrequest.event.RequestDetails;
import org.netpreserve.webrequest.event.Verdict;
import org.netpreserve.webrequest.util.NamedThreadFactory;
import org.netpreserve.webrequest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpHeaders;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.netpreserve.webrequest.event.LifecycleStage.*;
import static org.netpreserve.webrequest.util.LogUtils.abbreviate;

/**
 * Entry point for the network engine. Called at each lifecycle stage of a request, looks up the listener
 * registered for the request's context and runs it.
 * <p>
 * Decision stages return a future. When no listener applies the future is already completed with
 * {@link Verdict#PROCEED}; otherwise the request is held until the listener resolves its callback, and the
 * verdict has been applied to the {@link RequestOverrides} on the request's network executor by the time the
 * future completes. Listener failures are reported to the {@link ErrorReporter} and the request proceeds.
 */
public class WebRequestDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WebRequestDispatcher.class);
    private final ContextRegistry registry;
    private final ErrorReporter errorReporter;
    private final WebRequestConfig config;
    private final ScheduledExecutorService watchdog;

    public WebRequestDispatcher(ContextRegistry registry) {
        this(registry, WebRequestConfig.defaults());
    }

    public WebRequestDispatcher(ContextRegistry registry, WebRequestConfig config) {
        this(registry, new LoggingErrorReporter(config.maxLoggedUrlLength()), config);
    }

    public WebRequestDispatcher(ContextRegistry registry, ErrorReporter errorReporter, WebRequestConfig config) {
        this.registry = registry;
        this.errorReporter = errorReporter;
        this.config = config;
        this.watchdog = config.slowDecisionWarningEnabled() ?
                Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("webrequest-watchdog")) : null;
    }

    public CompletableFuture<Verdict> onBeforeRequest(RequestInfo request, RequestOverrides overrides) {
        return handleResponseEvent(BEFORE_REQUEST, request, overrides, request.toDetails());
    }

    public CompletableFuture<Verdict> onBeforeSendHeaders(RequestInfo request, RequestOverrides overrides) {
        return handleResponseEvent(BEFORE_SEND_HEADERS, request, overrides,
                request.toDetails().withRequestHeaders(request.requestHeaders()));
    }

    public CompletableFuture<Verdict> onHeadersReceived(RequestInfo request, RequestOverrides overrides) {
        return handleResponseEvent(HEADERS_RECEIVED, request, overrides,
                request.toDetails().withResponse(request.statusCode(), request.responseHeaders()));
    }

    public void onSendHeaders(RequestInfo request, HttpHeaders headers) {
        handleSimpleEvent(SEND_HEADERS, request, request.toDetails().withRequestHeaders(headers));
    }

    public void onBeforeRedirect(RequestInfo request, Url newLocation) {
        handleSimpleEvent(BEFORE_REDIRECT, request, request.toDetails()
                .withResponse(request.statusCode(), request.responseHeaders())
                .withRedirectUrl(newLocation));
    }

    public void onResponseStarted(RequestInfo request) {
        handleSimpleEvent(RESPONSE_STARTED, request, request.toDetails()
                .withResponse(request.statusCode(), request.responseHeaders()));
    }

    public void onErrorOccurred(RequestInfo request, NetError netError) {
        handleSimpleEvent(ERROR_OCCURRED, request, request.toDetails().withError(netError));
    }

    public void onCompleted(RequestInfo request, NetError netError) {
        handleSimpleEvent(COMPLETED, request, request.toDetails()
                .withResponse(request.statusCode(), request.responseHeaders())
                .withError(netError != null && netError.isError() ? netError : null));
    }

    /**
     * Number of decisions currently held for the context.
     */
    public int pendingCount(Object context) {
        return registry.get(context).map(WebRequest::pendingCount).orElse(0);
    }

    private void handleSimpleEvent(LifecycleStage stage, RequestInfo request, RequestDetails details) {
        EventCatalog.entry(stage).checkArguments(details);
        var webRequest = registry.get(request.context()).orElse(null);
        if (webRequest == null) return;
        var info = webRequest.simpleListener(stage);
        if (info == null || !info.filter().matches(request.url())) return;

        execute(webRequest, stage, request, () -> {
            try {
                info.listener().handle(details);
            } catch (Exception e) {
                errorReporter.report(new HandlerFaultException(stage, request.url(), e));
            }
        });
    }

    private CompletableFuture<Verdict> handleResponseEvent(LifecycleStage stage, RequestInfo request,
                                                           RequestOverrides overrides, RequestDetails details) {
        EventCatalog.entry(stage).checkArguments(details);
        var webRequest = registry.get(request.context()).orElse(null);
        if (webRequest == null) return CompletableFuture.completedFuture(Verdict.PROCEED);
        var info = webRequest.responseListener(stage);
        if (info == null || !info.filter().matches(request.url())) {
            return CompletableFuture.completedFuture(Verdict.PROCEED);
        }

        var decision = new PendingDecision(stage, request, overrides, errorReporter);
        if (!webRequest.track(decision)) {
            decision.abandon();
            return decision.future();
        }
        watch(decision);

        log.debug("Holding {} {} for listener decision", stage.eventName(), request.url());
        boolean submitted = execute(webRequest, stage, request, () -> {
            try {
                info.listener().handle(details, decision);
            } catch (Exception e) {
                decision.failOpen();
                errorReporter.report(new HandlerFaultException(stage, request.url(), e));
            }
        });
        if (!submitted) decision.abandon();
        return decision.future();
    }

    private boolean execute(WebRequest webRequest, LifecycleStage stage, RequestInfo request, Runnable task) {
        try {
            webRequest.listenerExecutor().execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Listener executor rejected {} for {}, context is probably being destroyed",
                    stage.eventName(), request.url(), e);
            return false;
        }
    }

    private void watch(PendingDecision decision) {
        if (watchdog == null) return;
        long delayNanos = config.slowDecisionWarning().toNanos();
        ScheduledFuture<?> warning;
        try {
            warning = watchdog.schedule(() -> {
                if (!decision.isDone()) {
                    log.atWarn().addKeyValue("stage", decision.stage().eventName())
                            .addKeyValue("url", abbreviate(decision.request().url(), config.maxLoggedUrlLength()))
                            .addKeyValue("pendingMillis", TimeUnit.NANOSECONDS.toMillis(decision.ageNanos()))
                            .log("Listener has not decided yet, request is still held");
                }
            }, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher closed, not watching {}", decision);
            return;
        }
        decision.future().whenComplete((verdict, t) -> warning.cancel(false));
    }

    @Override
    public void close() {
        if (watchdog != null) watchdog.shutdownNow();
    }
}
