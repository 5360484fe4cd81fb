package com.ctdl.scout.service.validate;

/**
 * Decides which probe results count as available.
 */
public enum AcceptancePolicy {

    /** Anything that answered at all, including 404 and 500. Only a status of 0 is rejected. */
    PROBE_REACHABLE {
        @Override
        public boolean accepts(int statusCode) {
            return statusCode != ValidatedLink.UNREACHABLE;
        }
    },

    /** Only 2xx answers. */
    HTTP_OK {
        @Override
        public boolean accepts(int statusCode) {
            return statusCode >= 200 && statusCode < 300;
        }
    };

    public abstract boolean accepts(int statusCode);
}
