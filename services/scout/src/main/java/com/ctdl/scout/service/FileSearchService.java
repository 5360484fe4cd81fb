package com.ctdl.scout.service;

import com.ctdl.scout.config.ScoutProperties;
import com.ctdl.scout.service.search.ResultPager;
import com.ctdl.scout.service.search.SearchParams;
import com.ctdl.scout.service.search.SearchQuery;
import com.ctdl.scout.service.validate.LinkValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FileSearchService finds live download links for a topic.
 * It pages through the search engine for {@code filetype:<ext> <topic>} and validates what it scraped.
 * Every call goes to the network; nothing is cached.
 */
@Service
@RequiredArgsConstructor
public class FileSearchService {

    private final ResultPager resultPager;
    private final LinkValidator linkValidator;
    private final ScoutProperties properties;
    private final LoggerService logger;

    public List<String> search(String query) {
        return search(new SearchQuery(query));
    }

    public List<String> search(String query, String fileType) {
        return search(new SearchQuery(query, fileType, SearchQuery.DEFAULT_LIMIT));
    }

    public List<String> search(String query, String fileType, int limit) {
        return search(new SearchQuery(query, fileType, limit));
    }

    /**
     * @return accepted links in scrape order
     * @throws com.ctdl.scout.service.search.SearchRequestException when a results page cannot be fetched
     */
    public List<String> search(SearchQuery query) {
        SearchParams params = SearchParams.forQuery(query);
        logger.debug("SEARCH", "Searching '" + params.query() + "' | limit=" + query.limit());

        List<String> candidates = resultPager.collect(query.limit(), params, requestHeaders());
        logger.info("SEARCH", "🔍 Found " + candidates.size() + " candidate links, checking availability...");

        List<String> available = linkValidator.validate(candidates);
        logger.info("SEARCH", "✅ " + available.size() + " of " + candidates.size() + " links are available");
        return available;
    }

    private Map<String, String> requestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", properties.getSearch().getUserAgent());
        headers.put("Accept", "text/html,application/xhtml+xml");
        return headers;
    }
}
