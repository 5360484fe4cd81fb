package com.ctdl.scout.service.search;

/**
 * Status and body of one search request.
 */
public record SearchResponse(int statusCode, String body) {
}
