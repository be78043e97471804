package org.netpreserve.webrequest.util;

import org.apache.commons.lang3.StringUtils;

public class LogUtils {
    public static String abbreviate(Url url, int maxLength) {
        if (url == null) return null;
        return abbreviate(url.toString(), maxLength);
    }

    /**
     * Shortens long values for log output by cutting out the middle, so the host and the end of the
     * path both stay visible.
     */
    public static String abbreviate(String string, int maxLength) {
        if (maxLength <= 0) return string;
        return StringUtils.abbreviateMiddle(string, "...", maxLength);
    }
}
