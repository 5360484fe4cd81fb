package com.ctdl.scout.service.validate;

/**
 * How candidate links are screened for an http(s) scheme before they are probed.
 */
public enum SchemeCheck {

    /**
     * Passes a candidate when its first 7 characters occur inside {@code "http://"} or its first 8
     * inside {@code "https://"}. This is a substring test, not a prefix test: fragments such as
     * {@code ""} or {@code "http:/"} pass too. They can never be probed successfully, so they never
     * reach the accepted set.
     */
    PREFIX_MEMBERSHIP {
        @Override
        public boolean accepts(String candidate) {
            return "http://".contains(head(candidate, 7)) || "https://".contains(head(candidate, 8));
        }
    },

    /**
     * Passes a candidate only when it starts with {@code http://} or {@code https://}.
     */
    STRICT_PREFIX {
        @Override
        public boolean accepts(String candidate) {
            return candidate.startsWith("http://") || candidate.startsWith("https://");
        }
    };

    public abstract boolean accepts(String candidate);

    private static String head(String value, int length) {
        return value.length() > length ? value.substring(0, length) : value;
    }
}
