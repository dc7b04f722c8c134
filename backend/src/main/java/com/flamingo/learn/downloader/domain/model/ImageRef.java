package com.flamingo.learn.downloader.domain.model;

/**
 * An image referenced by unit content.
 *
 * @param url absolute source URL, the de-duplication key
 * @param alt alternative text (may be empty)
 * @param width declared width, {@code null} when absent
 * @param height declared height, {@code null} when absent
 * @param originalSrc the reference exactly as it appeared in markup
 * @param referer page that referenced the image, sent as the HTTP referer
 */
public record ImageRef(
    String url, String alt, Integer width, Integer height, String originalSrc, String referer) {}
