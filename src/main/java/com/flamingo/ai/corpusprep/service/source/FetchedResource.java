package com.flamingo.ai.corpusprep.service.source;

/**
 * Body of a successfully fetched URL.
 *
 * @param url the requested URL
 * @param contentType {@code Content-Type} response header, {@code null} when absent
 * @param body response body
 */
public record FetchedResource(String url, String contentType, byte[] body) {}
