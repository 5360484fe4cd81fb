package com.ctdl.scout.service.search;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts result links from a search results page.
 * <p>
 * Each organic result carries an anchor whose href is wrapped in the engine's redirect
 * ({@code /url?q=<target>&sa=...}). The wrapper prefix and everything from the first {@code &} are dropped.
 */
@Slf4j
public class ResultScraper {

    private final String resultSelector;
    private final int prefixLength;

    public ResultScraper(String resultSelector, int prefixLength) {
        this.resultSelector = resultSelector;
        this.prefixLength = prefixLength;
    }

    /**
     * @param html raw markup of one results page
     * @return links in document order, empty when nothing matched
     */
    public List<String> scrape(String html) {
        List<String> links = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return links;
        }

        Document doc = Jsoup.parse(html);
        Elements results = doc.select(resultSelector);
        log.debug("🔍 Found {} result blocks matching '{}'", results.size(), resultSelector);

        for (Element result : results) {
            Element anchor = result.selectFirst("a");
            if (anchor == null) {
                log.warn("⚠️ Result block without a link skipped: {}", result.text());
                continue;
            }
            links.add(cleanHref(anchor.attr("href"), prefixLength));
        }
        return links;
    }

    /**
     * Strips the redirect wrapper and any tracking parameters. An href shorter than the wrapper becomes empty.
     */
    public static String cleanHref(String href, int prefixLength) {
        String target = href.length() > prefixLength ? href.substring(prefixLength) : "";
        int amp = target.indexOf('&');
        return amp >= 0 ? target.substring(0, amp) : target;
    }
}
