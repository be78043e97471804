package org.netpreserve.webrequest.dispatch;

import org.netpreserve.webrequest.WebRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.netpreserve.webrequest.util.LogUtils.abbreviate;

public class LoggingErrorReporter implements ErrorReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);
    private final int maxUrlLength;

    public LoggingErrorReporter(int maxUrlLength) {
        this.maxUrlLength = maxUrlLength;
    }

    @Override
    public void report(WebRequestException e) {
        if (e instanceof HandlerFaultException fault) {
            log.atWarn().addKeyValue("stage", fault.stage().eventName())
                    .addKeyValue("url", abbreviate(fault.url(), maxUrlLength))
                    .setCause(fault.getCause())
                    .log("Listener failed, letting request proceed");
        } else if (e instanceof ProtocolViolationException violation) {
            log.atError().addKeyValue("stage", violation.stage().eventName())
                    .addKeyValue("url", abbreviate(violation.url(), maxUrlLength))
                    .log(violation.getMessage());
        } else {
            log.error("Web request dispatch error", e);
        }
    }
}
