package com.flamingo.learn.downloader.service.scrape;

/**
 * A unit page that returned real content.
 *
 * @param url the URL that produced the content
 * @param html the page markup
 */
public record ResolvedPage(String url, String html) {}
