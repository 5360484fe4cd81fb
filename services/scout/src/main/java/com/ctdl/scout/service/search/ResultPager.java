package com.ctdl.scout.service.search;

import com.ctdl.scout.config.ScoutProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks the search results ten at a time until the requested number of links has been requested.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultPager {

    public static final int PAGE_SIZE = 10;

    private final SearchHttpClient searchHttpClient;
    private final ResultScraper resultScraper;
    private final ScoutProperties properties;

    /**
     * Requests pages at offsets {@code 0, 10, 20, ...} below {@code limit} and returns at most
     * {@code limit} links in page order. Runs short when the engine has fewer results.
     */
    public List<String> collect(int limit, SearchParams baseParams, Map<String, String> headers) {
        String searchUrl = properties.getSearch().getUrl();
        List<String> links = new ArrayList<>();

        for (int start = 0; start < limit; start += PAGE_SIZE) {
            SearchParams page = baseParams.atOffset(start);
            SearchResponse response = searchHttpClient.get(searchUrl, page.toMap(), headers);
            List<String> pageLinks = resultScraper.scrape(response.body());
            log.debug("📄 Page start={} status={} links={}", start, response.statusCode(), pageLinks.size());
            links.addAll(pageLinks);
        }

        if (links.size() > limit) {
            return new ArrayList<>(links.subList(0, limit));
        }
        return links;
    }
}
