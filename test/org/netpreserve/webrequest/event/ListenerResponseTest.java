package org.netpreserve.webrequest.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.netpreserve.webrequest.util.Json;
import org.netpreserve.webrequest.util.Url;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.webrequest.event.LifecycleStage.*;

class ListenerResponseTest {
    private static ListenerResponse parse(String json) throws JsonProcessingException {
        return Json.MAPPER.readValue(json, ListenerResponse.class);
    }

    @Test
    void testCancelWinsOnEveryStage() throws JsonProcessingException {
        var response = parse("{\"cancel\": true, \"redirectURL\": \"https://example.com/\"}");
        assertEquals(Verdict.CANCEL, response.toVerdict(BEFORE_REQUEST));
        assertEquals(Verdict.CANCEL, response.toVerdict(BEFORE_SEND_HEADERS));
        assertEquals(Verdict.CANCEL, response.toVerdict(HEADERS_RECEIVED));
    }

    @Test
    void testRedirect() throws JsonProcessingException {
        var response = parse("{\"redirectURL\": \"https://example.com/safe\"}");
        assertEquals(new Verdict.Redirect(new Url("https://example.com/safe")), response.toVerdict(BEFORE_REQUEST));
        assertEquals(new Verdict.RedirectUnsafe(new Url("https://example.com/safe")),
                response.toVerdict(HEADERS_RECEIVED));
        assertEquals(Verdict.PROCEED, response.toVerdict(BEFORE_SEND_HEADERS));
    }

    @Test
    void testHeaders() throws JsonProcessingException {
        var response = parse("{\"requestHeaders\": {\"User-Agent\": \"bot/1.0\", \"Accept\": [\"a\", \"b\"]}}");
        var verdict = response.toVerdict(BEFORE_SEND_HEADERS);
        var headers = assertInstanceOf(Verdict.ModifyHeaders.class, verdict).headers();
        assertEquals(List.of("bot/1.0"), headers.allValues("user-agent"));
        assertEquals(List.of("a", "b"), headers.allValues("Accept"));
        assertEquals(Verdict.PROCEED, response.toVerdict(BEFORE_REQUEST));

        var override = parse("{\"responseHeaders\": {\"Content-Type\": [\"text/plain\"]},"
                             + " \"redirectURL\": \"https://example.com/\"}");
        var overrideVerdict = assertInstanceOf(Verdict.OverrideResponseHeaders.class,
                override.toVerdict(HEADERS_RECEIVED));
        assertEquals("text/plain", overrideVerdict.headers().firstValue("content-type").orElseThrow());
    }

    @Test
    void testEmptyResponseProceeds() throws JsonProcessingException {
        var response = parse("{\"somethingElse\": 1}");
        assertEquals(Verdict.PROCEED, response.toVerdict(BEFORE_REQUEST));
        assertEquals(Verdict.PROCEED, parse("{\"cancel\": false}").toVerdict(HEADERS_RECEIVED));
        assertThrows(IllegalArgumentException.class, () -> response.toVerdict(COMPLETED));
    }
}
