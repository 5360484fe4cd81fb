package com.ctdl.scout.service.search;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request parameters for one results page: the composed query and the result offset.
 */
public record SearchParams(String query, int start) {

    public static SearchParams forQuery(SearchQuery query) {
        return new SearchParams("filetype:" + query.fileType() + " " + query.topic(), 0);
    }

    public SearchParams atOffset(int offset) {
        return new SearchParams(query, offset);
    }

    public Map<String, String> toMap() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("start", String.valueOf(start));
        return params;
    }
}
