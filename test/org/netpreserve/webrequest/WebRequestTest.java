package org.netpreserve.webrequest;

import org.junit.jupiter.api.Test;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.event.Verdict;
import org.netpreserve.webrequest.filter.InvalidPatternException;
import org.netpreserve.webrequest.util.Json;
import org.netpreserve.webrequest.util.Url;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebRequestTest {
    private final ContextRegistry registry = new ContextRegistry(Runnable::run);

    @Test
    void testSettingListenerReplacesPrevious() {
        var webRequest = registry.getOrCreate(new Object());
        ResponseListener first = (details, callback) -> callback.resolve(Verdict.CANCEL);
        ResponseListener second = (details, callback) -> callback.resolve(Verdict.PROCEED);

        webRequest.onBeforeRequest(FilterSpec.urls("*://example.com/*"), first);
        webRequest.onBeforeRequest(FilterSpec.ALL, second);

        var info = webRequest.responseListener(LifecycleStage.BEFORE_REQUEST);
        assertNotNull(info);
        assertSame(second, info.listener());
        assertTrue(info.filter().isEmpty());
        assertTrue(info.filter().matches(new Url("https://other.com/")));
    }

    @Test
    void testNullListenerClearsStage() {
        var webRequest = registry.getOrCreate(new Object());
        webRequest.onCompleted(FilterSpec.ALL, details -> {});
        assertNotNull(webRequest.get(LifecycleStage.COMPLETED));

        webRequest.onCompleted(FilterSpec.ALL, null);
        assertNull(webRequest.get(LifecycleStage.COMPLETED));

        // clearing an empty stage is a no-op
        webRequest.clear(LifecycleStage.ERROR_OCCURRED);
        assertNull(webRequest.get(LifecycleStage.ERROR_OCCURRED));
    }

    @Test
    void testStagesAreIndependent() {
        var webRequest = registry.getOrCreate(new Object());
        SimpleListener listener = details -> {};
        webRequest.onSendHeaders(FilterSpec.ALL, listener);
        webRequest.onBeforeSendHeaders(FilterSpec.ALL, (details, callback) -> callback.resolve(Verdict.PROCEED));

        webRequest.clear(LifecycleStage.BEFORE_SEND_HEADERS);

        assertNull(webRequest.get(LifecycleStage.BEFORE_SEND_HEADERS));
        var info = webRequest.simpleListener(LifecycleStage.SEND_HEADERS);
        assertNotNull(info);
        assertSame(listener, info.listener());
        assertNull(webRequest.responseListener(LifecycleStage.SEND_HEADERS));
    }

    @Test
    void testListenerKindMustMatchStage() {
        var webRequest = registry.getOrCreate(new Object());
        SimpleListener simple = details -> {};
        ResponseListener response = (details, callback) -> callback.resolve(Verdict.PROCEED);

        assertThrows(IllegalArgumentException.class,
                () -> webRequest.set(LifecycleStage.BEFORE_REQUEST, FilterSpec.ALL, simple));
        assertThrows(IllegalArgumentException.class,
                () -> webRequest.set(LifecycleStage.COMPLETED, FilterSpec.ALL, response));
        assertNull(webRequest.get(LifecycleStage.BEFORE_REQUEST));
        assertNull(webRequest.get(LifecycleStage.COMPLETED));
    }

    @Test
    void testInvalidPatternLeavesExistingListener() {
        var webRequest = registry.getOrCreate(new Object());
        SimpleListener original = details -> {};
        webRequest.onResponseStarted(FilterSpec.urls("*://example.com/*"), original);

        var e = assertThrows(InvalidPatternException.class,
                () -> webRequest.onResponseStarted(FilterSpec.urls("*://example.com/*", "example.com"), details -> {}));
        assertEquals("example.com", e.pattern());

        var info = webRequest.simpleListener(LifecycleStage.RESPONSE_STARTED);
        assertNotNull(info);
        assertSame(original, info.listener());
    }

    @Test
    void testFilterSpecFromJson() throws Exception {
        var spec = Json.MAPPER.readValue("{\"urls\": [\"*://example.com/*\", \"https://*.example.org/a/*\"]}",
                FilterSpec.class);
        assertEquals(List.of("*://example.com/*", "https://*.example.org/a/*"), spec.urls());
        var filter = spec.compile();
        assertTrue(filter.matches(new Url("http://example.com/x")));
        assertTrue(filter.matches(new Url("https://www.example.org/a/b")));
        assertFalse(filter.matches(new Url("https://www.example.org/b")));

        var empty = Json.MAPPER.readValue("{}", FilterSpec.class);
        assertTrue(empty.compile().matches(new Url("https://anything.test/")));
    }
}
