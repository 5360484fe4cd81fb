package com.ctdl.scout.config;

import com.ctdl.scout.service.catalog.ExtensionCatalog;
import com.ctdl.scout.service.catalog.ThreatClassifier;
import com.ctdl.scout.service.download.FileDownloader;
import com.ctdl.scout.service.download.FileNameResolver;
import com.ctdl.scout.service.search.ResultScraper;
import com.ctdl.scout.service.search.RetryPolicy;
import com.ctdl.scout.service.search.SearchHttpClient;
import com.ctdl.scout.service.validate.LinkProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the network collaborators from {@link ScoutProperties}.
 * The search client is the one process-wide session; the context closes it on shutdown.
 */
@Configuration
public class ScoutConfiguration {

    @Bean
    public RetryPolicy retryPolicy(ScoutProperties properties) {
        ScoutProperties.Http http = properties.getHttp();
        return new RetryPolicy(http.getMaxAttempts(), http.getBackoffFactor(), http.getBackoffMax());
    }

    @Bean(destroyMethod = "close")
    public SearchHttpClient searchHttpClient(RetryPolicy retryPolicy, ScoutProperties properties) {
        return new SearchHttpClient(retryPolicy, properties.getHttp().getTimeout());
    }

    @Bean
    public ResultScraper resultScraper(ScoutProperties properties) {
        ScoutProperties.Search search = properties.getSearch();
        return new ResultScraper(search.getResultSelector(), search.getRedirectPrefixLength());
    }

    @Bean
    public LinkProbe linkProbe(ScoutProperties properties) {
        return new LinkProbe(properties.getProbe().getTimeout(), properties.getSearch().getUserAgent());
    }

    @Bean
    public FileDownloader fileDownloader(ScoutProperties properties) {
        return new FileDownloader(properties.getDownload().getTimeout(), properties.getSearch().getUserAgent(),
                new FileNameResolver());
    }

    @Bean
    public ThreatClassifier threatClassifier() {
        return new ThreatClassifier(ExtensionCatalog.THREATS);
    }
}
