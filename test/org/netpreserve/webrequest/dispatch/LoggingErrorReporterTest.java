package org.netpreserve.webrequest.dispatch;

import org.junit.jupiter.api.Test;
import org.netpreserve.webrequest.RegistryNotFoundException;
import org.netpreserve.webrequest.event.LifecycleStage;
import org.netpreserve.webrequest.util.Url;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class LoggingErrorReporterTest {
    @Test
    void testReportsEveryKindWithoutThrowing() {
        var reporter = new LoggingErrorReporter(30);
        var url = new Url("https://example.com/" + "a".repeat(100));
        assertDoesNotThrow(() -> {
            reporter.report(new HandlerFaultException(LifecycleStage.BEFORE_REQUEST, url,
                    new IllegalStateException("boom")));
            reporter.report(new ProtocolViolationException(LifecycleStage.HEADERS_RECEIVED, url,
                    "decision already resolved"));
            reporter.report(new RegistryNotFoundException("session"));
        });
    }
}
