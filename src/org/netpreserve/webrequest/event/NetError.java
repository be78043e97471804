package org.netpreserve.webrequest.event;

/**
 * Network status codes exchanged with the network engine. Negative values are errors.
 */
public enum NetError {
    OK(0, "net::OK"),
    IO_PENDING(-1, "net::ERR_IO_PENDING"),
    FAILED(-2, "net::ERR_FAILED"),
    ABORTED(-3, "net::ERR_ABORTED"),
    TIMED_OUT(-7, "net::ERR_TIMED_OUT"),
    ACCESS_DENIED(-10, "net::ERR_ACCESS_DENIED"),
    BLOCKED_BY_CLIENT(-20, "net::ERR_BLOCKED_BY_CLIENT"),
    CONNECTION_RESET(-101, "net::ERR_CONNECTION_RESET"),
    CONNECTION_REFUSED(-102, "net::ERR_CONNECTION_REFUSED"),
    NAME_NOT_RESOLVED(-105, "net::ERR_NAME_NOT_RESOLVED"),
    UNSAFE_REDIRECT(-311, "net::ERR_UNSAFE_REDIRECT");

    private final int code;
    private final String errorText;

    NetError(int code, String errorText) {
        this.code = code;
        this.errorText = errorText;
    }

    public int code() {
        return code;
    }

    public String errorText() {
        return errorText;
    }

    public boolean isError() {
        return code < 0;
    }

    /**
     * Maps a numeric code back to a constant, {@link #FAILED} for codes this enum doesn't name.
     */
    public static NetError fromCode(int code) {
        for (NetError error : values()) {
            if (error.code == code) return error;
        }
        return FAILED;
    }
}
