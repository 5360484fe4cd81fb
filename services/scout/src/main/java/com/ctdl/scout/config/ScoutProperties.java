package com.ctdl.scout.config;

import com.ctdl.scout.service.validate.AcceptancePolicy;
import com.ctdl.scout.service.validate.SchemeCheck;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized settings for Scout, bound from the {@code scout.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "scout")
public class ScoutProperties {

    private Search search = new Search();
    private Http http = new Http();
    private Probe probe = new Probe();
    private Validation validation = new Validation();
    private Download download = new Download();

    @Data
    public static class Search {
        private String url = "https://www.google.com/search";
        private String userAgent = "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:53.0) Gecko/20100101 Firefox/53.0";
        /** CSS selector of one organic result block. */
        private String resultSelector = "h3.r";
        /** Length of the redirect wrapper in front of each result href ({@code /url?q=}). */
        private int redirectPrefixLength = 7;
    }

    @Data
    public static class Http {
        private Duration timeout = Duration.ofSeconds(15);
        private int maxAttempts = 5;
        private double backoffFactor = 0.1;
        private Duration backoffMax = Duration.ofSeconds(120);
    }

    @Data
    public static class Probe {
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Validation {
        private SchemeCheck schemeCheck = SchemeCheck.PREFIX_MEMBERSHIP;
        private AcceptancePolicy acceptance = AcceptancePolicy.PROBE_REACHABLE;
    }

    @Data
    public static class Download {
        private int parallelism = 4;
        private Duration timeout = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofHours(1);
    }
}
