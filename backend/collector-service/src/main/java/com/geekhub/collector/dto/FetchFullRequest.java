package com.geekhub.collector.dto;

/**
 * Optional override of the page to extract; the article link is used when absent.
 */
public record FetchFullRequest(String url) {
}
