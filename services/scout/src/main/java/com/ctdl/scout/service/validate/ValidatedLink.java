package com.ctdl.scout.service.validate;

/**
 * A probed link and the status it answered with. {@value #UNREACHABLE} means the probe never got an HTTP answer.
 */
public record ValidatedLink(String url, int statusCode) {

    public static final int UNREACHABLE = 0;

    public boolean isReachable() {
        return statusCode != UNREACHABLE;
    }

    public String toReportLine() {
        return String.format("code: %d\turl: %s", statusCode, url);
    }
}
