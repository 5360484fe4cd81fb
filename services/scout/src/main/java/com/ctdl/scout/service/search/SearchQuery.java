package com.ctdl.scout.service.search;

/**
 * What the user asked for: a topic, the file extension to look for and how many results to consider.
 */
public record SearchQuery(String topic, String fileType, int limit) {

    public static final String DEFAULT_FILE_TYPE = "pdf";
    public static final int DEFAULT_LIMIT = 10;

    public SearchQuery {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        if (fileType == null || fileType.isBlank()) {
            throw new IllegalArgumentException("fileType must not be blank");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative but was " + limit);
        }
    }

    public SearchQuery(String topic) {
        this(topic, DEFAULT_FILE_TYPE, DEFAULT_LIMIT);
    }
}
