package org.netpreserve.webrequest.filter;

import org.netpreserve.webrequest.WebRequestException;

public class InvalidPatternException extends WebRequestException {
    private final String pattern;

    public InvalidPatternException(String pattern, String reason) {
        super(reason + ": " + pattern);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
