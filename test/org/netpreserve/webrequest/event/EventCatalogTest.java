package org.netpreserve.webrequest.event;

import org.junit.jupiter.api.Test;
import org.netpreserve.webrequest.util.Url;

import java.net.http.HttpHeaders;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.webrequest.event.LifecycleStage.*;

class EventCatalogTest {
    private static final HttpHeaders HEADERS = HttpHeaders.of(Map.of("Accept", List.of("*/*")), (n, v) -> true);

    @Test
    void testFamiliesAreDisjointAndComplete() {
        var simple = EventCatalog.stages(EventCatalog.Family.SIMPLE);
        var decision = EventCatalog.stages(EventCatalog.Family.DECISION);
        assertEquals(EnumSet.of(SEND_HEADERS, BEFORE_REDIRECT, RESPONSE_STARTED, ERROR_OCCURRED, COMPLETED), simple);
        assertEquals(EnumSet.of(BEFORE_REQUEST, BEFORE_SEND_HEADERS, HEADERS_RECEIVED), decision);
        for (LifecycleStage stage : LifecycleStage.values()) {
            assertNotNull(EventCatalog.entry(stage), stage.name());
            assertEquals(decision.contains(stage), stage.isDecision());
        }
    }

    @Test
    void testAllowedVerdicts() {
        var beforeRequest = EventCatalog.entry(BEFORE_REQUEST);
        assertTrue(beforeRequest.allows(Verdict.PROCEED));
        assertTrue(beforeRequest.allows(Verdict.CANCEL));
        assertTrue(beforeRequest.allows(Verdict.redirect("https://example.com/safe")));
        assertFalse(beforeRequest.allows(new Verdict.ModifyHeaders(HEADERS)));
        assertFalse(beforeRequest.allows(Verdict.redirectUnsafe("https://example.com/")));

        var beforeSendHeaders = EventCatalog.entry(BEFORE_SEND_HEADERS);
        assertTrue(beforeSendHeaders.allows(new Verdict.ModifyHeaders(HEADERS)));
        assertFalse(beforeSendHeaders.allows(Verdict.redirect("https://example.com/")));

        var headersReceived = EventCatalog.entry(HEADERS_RECEIVED);
        assertTrue(headersReceived.allows(new Verdict.OverrideResponseHeaders(HEADERS)));
        assertTrue(headersReceived.allows(Verdict.redirectUnsafe("https://example.com/")));
        assertFalse(headersReceived.allows(new Verdict.ModifyHeaders(HEADERS)));
        assertFalse(headersReceived.allows(null));

        for (LifecycleStage stage : EventCatalog.stages(EventCatalog.Family.SIMPLE)) {
            assertEquals(Set.of(), EventCatalog.entry(stage).verdicts());
        }
    }

    @Test
    void testCancelIsTheOnlyAbortingVerdict() {
        assertEquals(NetError.BLOCKED_BY_CLIENT, Verdict.CANCEL.status());
        assertEquals(NetError.OK, Verdict.PROCEED.status());
        assertEquals(NetError.OK, Verdict.redirect("https://example.com/").status());
        assertEquals(NetError.OK, new Verdict.OverrideResponseHeaders(HEADERS).status());
    }

    @Test
    void testCheckArguments() {
        var details = new RequestDetails(1, new Url("https://example.com/"), "GET", "mainFrame");
        EventCatalog.entry(BEFORE_REQUEST).checkArguments(details);
        EventCatalog.entry(COMPLETED).checkArguments(details);
        assertThrows(IllegalArgumentException.class, () -> EventCatalog.entry(SEND_HEADERS).checkArguments(details));
        assertThrows(IllegalArgumentException.class, () -> EventCatalog.entry(BEFORE_REDIRECT).checkArguments(details));
        EventCatalog.entry(SEND_HEADERS).checkArguments(details.withRequestHeaders(HEADERS));
        EventCatalog.entry(HEADERS_RECEIVED).checkArguments(details.withResponse(200, HEADERS));
    }

    @Test
    void testEventNames() {
        assertEquals("onBeforeRequest", BEFORE_REQUEST.eventName());
        assertEquals(HEADERS_RECEIVED, LifecycleStage.fromEventName("onHeadersReceived"));
        assertThrows(IllegalArgumentException.class, () -> LifecycleStage.fromEventName("onMystery"));
    }
}
