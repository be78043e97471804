package org.netpreserve.webrequest;

/**
 * Base class of the errors raised by the registry and the dispatcher.
 */
public abstract class WebRequestException extends RuntimeException {
    protected WebRequestException(String message) {
        super(message);
    }

    protected WebRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
