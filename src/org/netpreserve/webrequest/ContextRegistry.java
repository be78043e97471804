package org.netpreserve.webrequest;

import org.netpreserve.webrequest.config.WebRequestConfig;
import org.netpreserve.webrequest.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Associates each owning context (compared by identity) with its single {@link WebRequest}.
 * The association lasts until {@link #onContextDestroyed(Object)} is called.
 */
public class ContextRegistry {
    private static final Logger log = LoggerFactory.getLogger(ContextRegistry.class);
    private final Map<Object, WebRequest> registries = new IdentityHashMap<>();
    private final Function<Object, Executor> executorFactory;
    private final boolean ownsExecutors;

    /**
     * Each registry gets its own single listener thread, shut down when its context is destroyed.
     */
    public ContextRegistry(WebRequestConfig config) {
        this(context -> Executors.newSingleThreadExecutor(new NamedThreadFactory(config.listenerThreadName())),
                true);
    }

    /**
     * All registries run their listeners on {@code listenerExecutor}, which the caller owns.
     */
    public ContextRegistry(Executor listenerExecutor) {
        this(context -> listenerExecutor, false);
    }

    private ContextRegistry(Function<Object, Executor> executorFactory, boolean ownsExecutors) {
        this.executorFactory = executorFactory;
        this.ownsExecutors = ownsExecutors;
    }

    public static ContextRegistry global() {
        return Global.INSTANCE;
    }

    public synchronized Optional<WebRequest> get(Object context) {
        if (context == null) return Optional.empty();
        return Optional.ofNullable(registries.get(context));
    }

    /**
     * @throws RegistryNotFoundException if no registry exists for the context
     */
    public WebRequest require(Object context) {
        return get(context).orElseThrow(() -> new RegistryNotFoundException(context));
    }

    public synchronized WebRequest getOrCreate(Object context) {
        Objects.requireNonNull(context, "context");
        var webRequest = registries.get(context);
        if (webRequest == null) {
            webRequest = create(context);
        }
        return webRequest;
    }

    /**
     * @throws RegistryAlreadyExistsException if the context already has a registry
     */
    public synchronized WebRequest createExclusive(Object context) {
        Objects.requireNonNull(context, "context");
        if (registries.containsKey(context)) {
            throw new RegistryAlreadyExistsException(context);
        }
        return create(context);
    }

    private WebRequest create(Object context) {
        var webRequest = new WebRequest(context, executorFactory.apply(context));
        registries.put(context, webRequest);
        log.debug("Created WebRequest for {}", context);
        return webRequest;
    }

    /**
     * Removes the context's registry and releases all of its held requests. Does nothing for unknown contexts.
     */
    public void onContextDestroyed(Object context) {
        WebRequest webRequest;
        synchronized (this) {
            webRequest = registries.remove(context);
        }
        if (webRequest == null) return;
        webRequest.destroy();
        if (ownsExecutors && webRequest.listenerExecutor() instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
    }

    public synchronized int size() {
        return registries.size();
    }

    private static class Global {
        static final ContextRegistry INSTANCE = new ContextRegistry(WebRequestConfig.defaults());
    }
}
